package skytiles.acquisition.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test step whose behaviour is a lambda. Writes a small file to its destination unless the
 * script throws first.
 */
public class ScriptedStep implements PipelineStep {

    @FunctionalInterface
    public interface Script {
        /**
         * @param context    run parameters
         * @param invocation 1-based call count across all timestamps
         */
        void run(StepContext context, int invocation) throws StepException, InterruptedException;
    }

    private final String name;
    private final String suffix;
    private final Script script;
    private final AtomicInteger invocations = new AtomicInteger();
    private final Map<String, Path> sources = new ConcurrentHashMap<>();
    private boolean idempotentSafe;

    public ScriptedStep(String name, String suffix, Script script) {
        this.name = name;
        this.suffix = suffix;
        this.script = script;
    }

    public static ScriptedStep succeeding(String name, String suffix) {
        return new ScriptedStep(name, suffix, (ctx, n) -> {
        });
    }

    public ScriptedStep idempotent() {
        this.idempotentSafe = true;
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Path destination(StepContext context) {
        return context.artifact(suffix);
    }

    @Override
    public void execute(StepContext context, Path source, Path destination)
            throws StepException, InterruptedException {
        if (source != null) {
            sources.put(context.timestamp().id(), source);
        }
        script.run(context, invocations.incrementAndGet());
        try {
            Files.writeString(destination, name + " " + context.timestamp().id());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public boolean idempotentSafe() {
        return idempotentSafe;
    }

    public int invocations() {
        return invocations.get();
    }

    /** The source path this step last received for a timestamp id */
    public Path sourceFor(String timestampId) {
        return sources.get(timestampId);
    }
}

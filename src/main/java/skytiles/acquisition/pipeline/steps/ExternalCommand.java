package skytiles.acquisition.pipeline.steps;

import skytiles.acquisition.pipeline.PermanentStepException;
import skytiles.acquisition.pipeline.StepException;
import skytiles.acquisition.pipeline.TransientStepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a GDAL tool (or the overlay command) as a child process.
 * <p>
 * Output is logged at DEBUG and the last lines are kept for the error message.
 * A tool that cannot be launched or that exceeds the timeout is a transient failure;
 * a non-zero exit is permanent. Interrupting the caller kills the process.
 */
public class ExternalCommand {

    private static final Logger log = LoggerFactory.getLogger(ExternalCommand.class);
    private static final int TAIL_LINES = 10;

    private final Duration timeout;

    public ExternalCommand(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Run a command to completion.
     *
     * @param label      tool name for logs and errors
     * @param command    program and arguments
     * @param workingDir process working directory
     */
    public void run(String label, List<String> command, Path workingDir) throws StepException, InterruptedException {
        log.debug("Running {}: {}", label, String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workingDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new TransientStepException("cannot launch " + label + ": " + e.getMessage(), e);
        }

        Deque<String> tail = new ArrayDeque<>();
        Thread reader = new Thread(() -> drain(label, process, tail), "skytiles-" + label + "-output");
        reader.setDaemon(true);
        reader.start();

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        if (!finished) {
            process.destroyForcibly();
            throw new TransientStepException(label + " timed out after " + timeout);
        }
        reader.join(1000);

        int exit = process.exitValue();
        if (exit != 0) {
            String output;
            synchronized (tail) {
                output = String.join(" | ", tail);
            }
            throw new PermanentStepException(label + " exited with " + exit
                    + (output.isEmpty() ? "" : ": " + output));
        }
    }

    private void drain(String label, Process process, Deque<String> tail) {
        try (BufferedReader out = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = out.readLine()) != null) {
                log.debug("[{}] {}", label, line);
                synchronized (tail) {
                    if (tail.size() == TAIL_LINES) {
                        tail.removeFirst();
                    }
                    tail.addLast(line);
                }
            }
        } catch (IOException e) {
            log.debug("[{}] output closed: {}", label, e.getMessage());
        }
    }
}

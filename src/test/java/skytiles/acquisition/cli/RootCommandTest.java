package skytiles.acquisition.cli;

import skytiles.acquisition.config.AcquisitionConfig;
import skytiles.acquisition.config.Dependencies;
import skytiles.acquisition.pipeline.PipelineDefinition;
import skytiles.acquisition.pipeline.ScriptedStep;
import skytiles.acquisition.pipeline.TransientStepException;
import skytiles.acquisition.scheduler.DispatchOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RootCommandTest {

    @TempDir
    Path root;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private final AtomicInteger failures = new AtomicInteger();
    private ScriptedStep step;
    private String dbUrl;

    @BeforeEach
    void setUp() {
        step = new ScriptedStep("acquire", ".png", (ctx, n) -> {
            if (n <= failures.get()) {
                throw new TransientStepException("HTTP 503 from tile server");
            }
        });
        dbUrl = "jdbc:h2:mem:test-cli-" + System.nanoTime() + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE";
    }

    private RootCommand command() {
        return new RootCommand(config -> Dependencies.create(config, Clock.systemUTC(),
                (c, index) -> new PipelineDefinition(List.of(step))));
    }

    private int execute(String... args) {
        return execute(root.resolve("state"), args);
    }

    private int execute(Path stateDir, String... args) {
        List<String> all = new ArrayList<>(List.of(
                "--data-dir", root.resolve("data").toString(),
                "--state-dir", stateDir.toString(),
                "--db-url", dbUrl));
        all.addAll(List.of(args));
        CommandLine cli = new CommandLine(command());
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
        return cli.execute(all.toArray(String[]::new));
    }

    @Test
    void oneShotRunSucceeds() {
        int code = execute("--timestamp", "20250301101500");

        assertEquals(ExitCodes.OK, code, err.toString());
        assertTrue(out.toString().contains("20250301101500 succeeded"), out.toString());
        assertEquals(1, step.invocations());
    }

    @Test
    void alreadySucceededNeedsForce() {
        assertEquals(ExitCodes.OK, execute("-t", "20250301101500"));

        assertEquals(ExitCodes.OK, execute("-t", "20250301101500"));
        assertTrue(out.toString().contains("already succeeded"), out.toString());
        assertEquals(1, step.invocations());

        assertEquals(ExitCodes.OK, execute("-t", "20250301101500", "--force"));
        assertEquals(2, step.invocations());
    }

    @Test
    void retriesAfterBackoffUntilSuccess() {
        failures.set(1);

        int code = execute("--timestamp", "20250301101500", "--backoff-base", "PT0.2S", "--max-attempts", "3");

        assertEquals(ExitCodes.OK, code, err.toString());
        assertEquals(2, step.invocations());
        assertTrue(err.toString().contains("failed attempt 1: step 1 (acquire): HTTP 503 from tile server"),
                err.toString());
        assertTrue(out.toString().contains("20250301101500 succeeded"), out.toString());
    }

    @Test
    void givingUpExitsWithStepFailure() {
        failures.set(Integer.MAX_VALUE);

        int code = execute("--timestamp", "20250301101500", "--backoff-base", "PT0.1S", "--max-attempts", "2");

        assertEquals(ExitCodes.STEP_FAILURE, code);
        assertEquals(2, step.invocations());
        assertTrue(err.toString().contains("gave up after attempt 2: step 1 (acquire): HTTP 503 from tile server"),
                err.toString());
    }

    @Test
    void malformedTimestampIsConfigurationError() {
        assertEquals(ExitCodes.CONFIGURATION, execute("--timestamp", "2025-03-01"));
        assertEquals(0, step.invocations());
    }

    @Test
    void forceWithoutTimestampIsConfigurationError() {
        assertEquals(ExitCodes.CONFIGURATION, execute("--force"));
        assertTrue(err.toString().contains("--force requires --timestamp"));
    }

    @Test
    void stateDirInsideDataDirIsRejected() {
        int code = execute(root.resolve("data").resolve("state"), "-t", "20250301101500");

        assertEquals(ExitCodes.CONFIGURATION, code);
        assertTrue(err.toString().contains("state-dir must live outside data-dir"), err.toString());
    }

    @Test
    void optionsOverrideDefaults() {
        RootCommand cmd = new RootCommand();
        new CommandLine(cmd).parseArgs(
                "--concurrency", "3",
                "--crop-x", "12",
                "--north", "50",
                "--cadence", "10",
                "--backfill-window", "PT0S",
                "--max-attempts", "4",
                "--keep-source",
                "--zoom-range", "2-7",
                "--status-port", "8081");

        AcquisitionConfig config = cmd.buildConfig(AcquisitionConfig.defaults());

        assertEquals(3, config.concurrency());
        assertEquals(12, config.cropX());
        assertEquals(-162, config.cropY());
        assertEquals(50.0, config.north());
        assertEquals(-55.0, config.south());
        assertEquals(Duration.ofMinutes(10), config.cadence());
        assertEquals(Duration.ZERO, config.backfillWindow());
        assertEquals(4, config.maxAttempts());
        assertTrue(config.keepFiles());
        assertEquals("2-7", config.zoomRange());
        assertEquals(8081, config.statusPort());
    }

    @Test
    void exitCodesFollowOutcome() {
        assertEquals(ExitCodes.OK, ExitCodes.of(DispatchOutcome.SUCCEEDED));
        assertEquals(ExitCodes.OK, ExitCodes.of(DispatchOutcome.SKIPPED_SUCCEEDED));
        assertEquals(ExitCodes.STEP_FAILURE, ExitCodes.of(DispatchOutcome.GAVE_UP));
        assertEquals(ExitCodes.CONFLICT, ExitCodes.of(DispatchOutcome.SKIPPED_RUNNING));
        assertEquals(ExitCodes.RESOURCE, ExitCodes.of(DispatchOutcome.REJECTED));
    }
}

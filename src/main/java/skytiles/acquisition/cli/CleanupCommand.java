package skytiles.acquisition.cli;

import skytiles.acquisition.retention.NoonRetentionCleaner;
import skytiles.acquisition.retention.NoonRetentionCleaner.CleanupReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "cleanup", mixinStandardHelpOptions = true,
        description = "Keep only the frames published at local noon; dry run unless --execute.")
public class CleanupCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CleanupCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = "--tiles-dir", required = true, description = "Directory holding timestamps.json and the frame folders.")
    Path tilesDir;

    @Option(names = {"--timezone", "-tz"}, defaultValue = "8", description = "UTC offset in hours that defines noon (default: ${DEFAULT-VALUE}).")
    int timezone;

    @Option(names = "--execute", description = "Actually delete; otherwise only report.")
    boolean execute;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (timezone < -18 || timezone > 18) {
            err.println("Configuration error: --timezone must be within -18..18");
            return ExitCodes.CONFIGURATION;
        }

        CleanupReport report;
        try {
            report = new NoonRetentionCleaner(tilesDir, timezone).clean(execute);
        } catch (IOException e) {
            log.error("Cleanup of {} failed", tilesDir, e);
            err.println("Cannot read timestamp index in " + tilesDir + ": " + e.getMessage());
            return ExitCodes.CONFIGURATION;
        }

        out.printf("%s: keep %d, remove %d%n", execute ? "Cleaned" : "Dry run", report.kept(), report.toRemove());
        if (execute) {
            out.printf("Deleted %d folders, %d already absent, %d failed%n",
                    report.deleted(), report.missing(), report.failed());
        }
        return report.failed() > 0 ? ExitCodes.RESOURCE : ExitCodes.OK;
    }
}

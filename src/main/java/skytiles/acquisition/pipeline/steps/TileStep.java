package skytiles.acquisition.pipeline.steps;

import skytiles.acquisition.config.AcquisitionConfig;
import skytiles.acquisition.pipeline.PermanentStepException;
import skytiles.acquisition.pipeline.PipelineStep;
import skytiles.acquisition.pipeline.StepContext;
import skytiles.acquisition.pipeline.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Cuts the Mercator raster into a web-map tile pyramid in a staging directory.
 */
public class TileStep implements PipelineStep {

    private static final Logger log = LoggerFactory.getLogger(TileStep.class);

    static final String TITLE = "FY-4B Satellite View";

    private final String gdal2tiles;
    private final String zoomRange;
    private final int processes;
    private final ExternalCommand commands;

    public TileStep(AcquisitionConfig config, ExternalCommand commands) {
        this.gdal2tiles = config.gdal2tiles();
        this.zoomRange = config.zoomRange();
        this.processes = Math.max(1, Runtime.getRuntime().availableProcessors());
        this.commands = commands;
    }

    @Override
    public String name() {
        return "tile";
    }

    @Override
    public Path destination(StepContext context) {
        return context.workDir().resolve("tiles-staging");
    }

    @Override
    public void execute(StepContext context, Path source, Path destination)
            throws StepException, InterruptedException {
        commands.run(gdal2tiles, command(source, destination), context.workDir());
        if (!Files.isDirectory(destination)) {
            throw new PermanentStepException(gdal2tiles + " did not create " + destination);
        }
        log.info("Tiled zoom {} into {}", zoomRange, destination.getFileName());
    }

    List<String> command(Path source, Path destination) {
        return List.of(gdal2tiles,
                "--profile", "mercator",
                "--zoom", zoomRange,
                "--processes", Integer.toString(processes),
                "--webviewer", "leaflet",
                "--title", TITLE,
                source.toString(), destination.toString());
    }
}

package skytiles.acquisition.pipeline.steps;

import skytiles.acquisition.config.AcquisitionConfig;
import skytiles.acquisition.pipeline.PipelineStep;
import skytiles.acquisition.pipeline.StepContext;
import skytiles.acquisition.pipeline.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Assigns the geostationary projection to the adjusted disk and warps it to Web Mercator,
 * clipped to the configured bounding box.
 */
public class GeoreferenceStep implements PipelineStep {

    private static final Logger log = LoggerFactory.getLogger(GeoreferenceStep.class);

    /** FY-4B sits at 104.7E */
    static final String GEOS_PROJ = "+proj=geos +h=35785831 +lon_0=104.7 +sweep=x +datum=WGS84 +units=m";
    /** Half-width of the full disk in projection metres */
    static final String EXTENT = "5568748";
    static final int OUTPUT_WIDTH = 4096;

    private final String gdalTranslate;
    private final String gdalwarp;
    private final double north;
    private final double south;
    private final double west;
    private final double east;
    private final ExternalCommand commands;

    public GeoreferenceStep(AcquisitionConfig config, ExternalCommand commands) {
        this.gdalTranslate = config.gdalTranslate();
        this.gdalwarp = config.gdalwarp();
        this.north = config.north();
        this.south = config.south();
        this.west = config.west();
        this.east = config.east();
        this.commands = commands;
    }

    @Override
    public String name() {
        return "georeference";
    }

    @Override
    public Path destination(StepContext context) {
        return context.artifact("_adjusted_mercator.tif");
    }

    @Override
    public void execute(StepContext context, Path source, Path destination)
            throws StepException, InterruptedException {
        Path vrt = context.artifact("_geos.vrt");
        try {
            commands.run(gdalTranslate, translateCommand(source, vrt), context.workDir());
            commands.run(gdalwarp, warpCommand(vrt, destination), context.workDir());
        } finally {
            try {
                Files.deleteIfExists(vrt);
            } catch (IOException e) {
                log.warn("Could not delete {}: {}", vrt, e.getMessage());
            }
        }
        log.info("Warped to EPSG:3857 within N{} S{} W{} E{}", north, south, west, east);
    }

    List<String> translateCommand(Path source, Path vrt) {
        return List.of(gdalTranslate,
                "-of", "VRT",
                "-a_srs", GEOS_PROJ,
                "-a_ullr", "-" + EXTENT, EXTENT, EXTENT, "-" + EXTENT,
                source.toString(), vrt.toString());
    }

    List<String> warpCommand(Path vrt, Path destination) {
        return List.of(gdalwarp,
                "-overwrite",
                "-t_srs", "EPSG:3857",
                "-te_srs", "EPSG:4326",
                "-te", fmt(west), fmt(south), fmt(east), fmt(north),
                "-r", "bilinear",
                "-dstalpha",
                "-ts", Integer.toString(OUTPUT_WIDTH), "0",
                "-of", "GTiff",
                "-co", "COMPRESS=LZW",
                "-co", "TILED=YES",
                vrt.toString(), destination.toString());
    }

    private static String fmt(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}

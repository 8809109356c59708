package skytiles.acquisition.pipeline;

import skytiles.acquisition.config.AcquisitionConfig;
import skytiles.acquisition.pipeline.steps.*;

import java.util.ArrayList;
import java.util.List;

/**
 * The ordered step list every run executes.
 */
public final class PipelineDefinition {

    private final List<PipelineStep> steps;

    public PipelineDefinition(List<PipelineStep> steps) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("pipeline has no steps");
        }
        this.steps = List.copyOf(steps);
    }

    /**
     * acquire, adjust, georeference, [overlay,] tile, publish.
     */
    public static PipelineDefinition standard(AcquisitionConfig config, TimestampIndex index) {
        ExternalCommand commands = new ExternalCommand(config.commandTimeout());
        List<PipelineStep> steps = new ArrayList<>();
        steps.add(new AcquireStep(config));
        steps.add(new AdjustStep(config.cropX(), config.cropY(), config.threshold()));
        steps.add(new GeoreferenceStep(config, commands));
        if (config.overlayEnabled()) {
            steps.add(new OverlayStep(config.overlayCommand(), config.overlayAsset(), commands));
        }
        steps.add(new TileStep(config, commands));
        steps.add(new PublishStep(config.tilesDir(), index));
        return new PipelineDefinition(steps);
    }

    public List<PipelineStep> steps() {
        return steps;
    }

    public List<String> stepNames() {
        return steps.stream().map(PipelineStep::name).toList();
    }
}

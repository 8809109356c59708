package skytiles.acquisition.pipeline.steps;

import skytiles.acquisition.pipeline.PermanentStepException;
import skytiles.acquisition.pipeline.PipelineStep;
import skytiles.acquisition.pipeline.StepContext;
import skytiles.acquisition.pipeline.StepException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Optional annotation pass (e.g. drawing boundaries) done by an external command.
 * The command line is split on whitespace; {input}, {output} and {asset} are substituted.
 */
public class OverlayStep implements PipelineStep {

    private final String commandTemplate;
    private final Path asset;
    private final ExternalCommand commands;

    public OverlayStep(String commandTemplate, Path asset, ExternalCommand commands) {
        this.commandTemplate = commandTemplate;
        this.asset = asset;
        this.commands = commands;
    }

    @Override
    public String name() {
        return "overlay";
    }

    @Override
    public Path destination(StepContext context) {
        return context.artifact("_annotated.tif");
    }

    @Override
    public void execute(StepContext context, Path source, Path destination)
            throws StepException, InterruptedException {
        if (asset != null && !Files.isReadable(asset)) {
            throw new PermanentStepException("overlay asset not readable: " + asset);
        }
        List<String> command = command(source, destination);
        commands.run(command.get(0), command, context.workDir());
    }

    List<String> command(Path source, Path destination) {
        List<String> command = new ArrayList<>();
        for (String part : commandTemplate.trim().split("\\s+")) {
            command.add(part
                    .replace("{input}", source.toString())
                    .replace("{output}", destination.toString())
                    .replace("{asset}", asset == null ? "" : asset.toString()));
        }
        return command;
    }
}

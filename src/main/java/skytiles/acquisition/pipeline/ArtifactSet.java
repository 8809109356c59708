package skytiles.acquisition.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Intermediate artifacts produced during one run.
 * Closing deletes everything registered except the artifact marked as kept, on success
 * and failure paths alike. With {@code keepFiles} nothing is deleted.
 */
public final class ArtifactSet implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ArtifactSet.class);

    private final boolean keepFiles;
    private final List<Path> registered = new ArrayList<>();
    private Path kept;

    public ArtifactSet(boolean keepFiles) {
        this.keepFiles = keepFiles;
    }

    public void register(Path artifact) {
        if (!registered.contains(artifact)) {
            registered.add(artifact);
        }
    }

    /** Exempt the final artifact from cleanup */
    public void keep(Path artifact) {
        this.kept = artifact;
    }

    public List<Path> registered() {
        return List.copyOf(registered);
    }

    @Override
    public void close() {
        if (keepFiles) {
            log.debug("Keeping {} intermediate artifacts", registered.size());
            return;
        }
        for (Path artifact : registered) {
            if (artifact.equals(kept)) {
                continue;
            }
            try {
                if (FileTrees.deleteRecursively(artifact)) {
                    log.debug("Deleted intermediate {}", artifact);
                }
            } catch (IOException e) {
                log.warn("Could not delete intermediate {}: {}", artifact, e.getMessage());
            }
        }
    }
}

package skytiles.acquisition.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * The published-timestamps index: {@code timestamps.json}, a sorted JSON array of unix seconds,
 * one per {@code tiles/<epochSecond>/} folder that map viewers can load.
 * <p>
 * Writes go to a temp file that is then moved over the index, so readers never see a partial file.
 */
public class TimestampIndex {

    private static final Logger log = LoggerFactory.getLogger(TimestampIndex.class);
    private static final TypeReference<List<Long>> LIST_OF_LONGS = new TypeReference<>() {
    };

    public static final String FILE_NAME = "timestamps.json";

    private final Path file;
    private final ObjectMapper mapper;

    public TimestampIndex(Path tilesDir) {
        this(tilesDir, new ObjectMapper());
    }

    public TimestampIndex(Path tilesDir, ObjectMapper mapper) {
        this.file = tilesDir.resolve(FILE_NAME);
        this.mapper = mapper;
    }

    public Path file() {
        return file;
    }

    /**
     * Read the index. A missing file is an empty index.
     *
     * @throws IOException if the file exists but is not a JSON array of integers
     */
    public synchronized List<Long> read() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<Long> values = mapper.readValue(file.toFile(), LIST_OF_LONGS);
            return values == null ? List.of() : values;
        } catch (JsonProcessingException e) {
            throw new IOException("malformed " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Add a published timestamp. No-op if already present.
     *
     * @return true if the index changed
     */
    public synchronized boolean add(long epochSecond) throws IOException {
        TreeSet<Long> values = new TreeSet<>(read());
        if (!values.add(epochSecond)) {
            return false;
        }
        write(new ArrayList<>(values));
        log.debug("Index now lists {} timestamps", values.size());
        return true;
    }

    /**
     * Replace the index contents, sorted and de-duplicated.
     */
    public synchronized void replace(List<Long> epochSeconds) throws IOException {
        write(new ArrayList<>(new TreeSet<>(epochSeconds)));
    }

    private void write(List<Long> sorted) throws IOException {
        Files.createDirectories(file.getParent());
        Path tmp = Files.createTempFile(file.getParent(), FILE_NAME, ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), sorted);
            FileTrees.move(tmp, file);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}

package org.smileyface.campuscrawler.persist;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.campuscrawler.model.FrontierState;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Stores the checkpoint as a pretty-printed JSON file. The document is written to a temporary sibling
 * first and then moved over the checkpoint, so an interrupted save leaves the previous checkpoint
 * readable.
 */
public class JsonFileStatePersister implements StatePersister {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStatePersister.class);

    private final Path stateFile;
    private final ObjectMapper mapper;

    public JsonFileStatePersister(Path stateFile, ObjectMapper mapper) {
        this.stateFile = Objects.requireNonNull(stateFile, "stateFile").toAbsolutePath();
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Path getStateFile() {
        return stateFile;
    }

    @Override
    public void save(FrontierState state) throws IOException {
        FrontierState toWrite = state == null ? FrontierState.empty() : state;
        Path dir = stateFile.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), toWrite);
            try {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Checkpoint written to {} (visited={}, queued={})",
                stateFile, toWrite.visited().size(), toWrite.queue().size());
    }

    @Override
    public FrontierState load() {
        if (!Files.isRegularFile(stateFile)) {
            log.info("No checkpoint at {}, starting fresh", stateFile);
            return FrontierState.empty();
        }
        try {
            FrontierState state = mapper.readValue(stateFile.toFile(), FrontierState.class);
            return state == null ? FrontierState.empty() : state;
        } catch (IOException e) {
            log.warn("Checkpoint {} could not be read, starting fresh: {}", stateFile, e.getMessage());
            return FrontierState.empty();
        }
    }
}

package org.smileyface.campuscrawler.persist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.smileyface.campuscrawler.model.FrontierState;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class JsonFileStatePersisterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void writesVisitedAndQueueAsJsonDocument() throws IOException {
        Path file = tempDir.resolve("crawl_state.json");
        JsonFileStatePersister persister = new JsonFileStatePersister(file, mapper);

        persister.save(new FrontierState(Set.of("https://www.bracu.ac.bd/a"), List.of("https://www.bracu.ac.bd/b")));

        JsonNode json = mapper.readTree(file.toFile());
        assertThat(json.fieldNames()).toIterable().containsExactlyInAnyOrder("visited", "queue");
        assertThat(json.get("visited").get(0).asText()).isEqualTo("https://www.bracu.ac.bd/a");
        assertThat(json.get("queue").get(0).asText()).isEqualTo("https://www.bracu.ac.bd/b");
        assertThat(Files.readString(file)).contains("\n");
        assertThat(tempDir.resolve("crawl_state.json.tmp")).doesNotExist();
    }

    @Test
    void corruptCheckpointLoadsAsEmptyState() throws IOException {
        Path file = tempDir.resolve("crawl_state.json");
        Files.writeString(file, "{\"visited\": [\"https://www.bracu.ac.bd/a\", ", StandardCharsets.UTF_8);

        FrontierState state = new JsonFileStatePersister(file, mapper).load();

        assertThat(state.isEmpty()).isTrue();
    }

    @Test
    void checkpointWithMissingFieldsLoadsPartially() throws IOException {
        Path file = tempDir.resolve("crawl_state.json");
        Files.writeString(file, "{\"queue\": [\"https://www.bracu.ac.bd/q\"]}", StandardCharsets.UTF_8);

        FrontierState state = new JsonFileStatePersister(file, mapper).load();

        assertThat(state.visited()).isEmpty();
        assertThat(state.queue()).containsExactly("https://www.bracu.ac.bd/q");
    }

    @Test
    void createsMissingParentDirectories() throws IOException {
        Path file = tempDir.resolve("nested/dir/crawl_state.json");
        new JsonFileStatePersister(file, mapper).save(FrontierState.empty());
        assertThat(file).exists();
    }
}

package org.smileyface.campuscrawler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable snapshot of the crawl frontier: the URLs already visited and the ordered queue of
 * pending URLs. This is the checkpoint document, serialized as
 * {@code {"visited": [...], "queue": [...]}}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record FrontierState(Set<String> visited, List<String> queue) {

    public FrontierState {
        // Missing fields in a checkpoint deserialize as null
        visited = visited == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(visited));
        queue = queue == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(queue));
    }

    public static FrontierState empty() {
        return new FrontierState(Set.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return visited.isEmpty() && queue.isEmpty();
    }
}

package org.smileyface.campuscrawler.extractor;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drops lines that are nothing but a UI label ("Read More", "Back to top", ...). The comparison is
 * a case-insensitive exact match; a label embedded in a longer sentence is kept.
 */
public final class JunkLabelRule implements LineRule {

    private final Set<String> labels;

    public JunkLabelRule(Collection<String> labels) {
        this.labels = labels == null ? Set.of() : labels.stream()
                .filter(l -> l != null && !l.isBlank())
                .map(l -> l.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public JunkLabelRule(String... labels) {
        this(labels == null ? List.of() : List.of(labels));
    }

    public Set<String> getLabels() {
        return labels;
    }

    @Override
    public boolean isAccepted(String line, Set<String> keptLines) {
        if (line == null) return false;
        return !labels.contains(line.toLowerCase(Locale.ROOT));
    }
}

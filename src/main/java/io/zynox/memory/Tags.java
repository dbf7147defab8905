package io.zynox.memory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tag list helpers.
 */
final class Tags {

    private Tags() {
    }

    /**
     * Caller tags followed by the auto-derived emotion tag, duplicates and nulls dropped,
     * first occurrence wins.
     */
    static List<String> merge(Collection<String> callerTags, Optional<Emotion> emotion) {
        Set<String> merged = new LinkedHashSet<>();
        if (callerTags != null) {
            for (String tag : callerTags) {
                if (tag != null) {
                    merged.add(tag);
                }
            }
        }
        emotion.ifPresent(e -> merged.add(e.tag()));
        return new ArrayList<>(merged);
    }
}

package io.zynox.memory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Emotion tags derived from memory text.
 *
 * <p>Declaration order is the match priority: text that contains both a {@code SAD} and a
 * {@code HAPPY} keyword is tagged {@code sad}. Keywords match as case-insensitive substrings,
 * so "madness" counts as {@code ANGRY}.</p>
 */
public enum Emotion {
    SAD("sad", List.of("sad", "depressed", "tired", "lonely")),
    HAPPY("happy", List.of("happy", "joy", "excited", "great")),
    ANGRY("angry", List.of("angry", "mad", "furious", "upset"));

    private final String tag;
    private final List<String> keywords;

    Emotion(String tag, List<String> keywords) {
        this.tag = tag;
        this.keywords = keywords;
    }

    public String tag() {
        return tag;
    }

    public List<String> keywords() {
        return keywords;
    }

    /**
     * Returns the first emotion (by priority) whose keyword list matches the text.
     */
    public static Optional<Emotion> classify(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        String lower = text.toLowerCase(Locale.ROOT);
        for (Emotion emotion : values()) {
            for (String keyword : emotion.keywords) {
                if (lower.contains(keyword)) {
                    return Optional.of(emotion);
                }
            }
        }
        return Optional.empty();
    }
}

package io.zynox.memory;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TagsTest {

    @Test
    void shouldNotDuplicateDetectedEmotion() {
        assertEquals(List.of("happy"), Tags.merge(List.of("happy"), Optional.of(Emotion.HAPPY)));
    }

    @Test
    void shouldAppendEmotionAfterCallerTags() {
        assertEquals(List.of("work", "todo", "sad"),
                Tags.merge(List.of("work", "todo"), Optional.of(Emotion.SAD)));
    }

    @Test
    void shouldDropDuplicateCallerTagsKeepingFirstPosition() {
        assertEquals(List.of("b", "a"), Tags.merge(List.of("b", "a", "b", "a"), Optional.empty()));
    }

    @Test
    void shouldHandleMissingCallerTags() {
        assertEquals(List.of("angry"), Tags.merge(null, Optional.of(Emotion.ANGRY)));
        assertEquals(List.of(), Tags.merge(null, Optional.empty()));
        assertEquals(List.of("x"), Tags.merge(Arrays.asList("x", null), Optional.empty()));
    }
}

package io.zynox.memory;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EmotionTest {

    @Test
    void shouldDetectEachEmotion() {
        assertEquals(Optional.of(Emotion.SAD), Emotion.classify("I feel so lonely today"));
        assertEquals(Optional.of(Emotion.HAPPY), Emotion.classify("What a great day"));
        assertEquals(Optional.of(Emotion.ANGRY), Emotion.classify("I am furious about it"));
    }

    @Test
    void shouldPreferSadOverHappy() {
        assertEquals(Optional.of(Emotion.SAD), Emotion.classify("I am sad but happy"));
    }

    @Test
    void shouldPreferHappyOverAngry() {
        assertEquals(Optional.of(Emotion.HAPPY), Emotion.classify("excited and upset at once"));
    }

    @Test
    void shouldMatchCaseInsensitively() {
        assertEquals(Optional.of(Emotion.HAPPY), Emotion.classify("JOY to the world"));
        assertEquals(Optional.of(Emotion.SAD), Emotion.classify("So TiReD"));
    }

    @Test
    void shouldMatchSubstrings() {
        // "madness" contains "mad"
        assertEquals(Optional.of(Emotion.ANGRY), Emotion.classify("pure madness"));
    }

    @Test
    void shouldReturnEmptyWhenNothingMatches() {
        assertTrue(Emotion.classify("The meeting is at noon").isEmpty());
        assertTrue(Emotion.classify("").isEmpty());
        assertTrue(Emotion.classify(null).isEmpty());
    }

    @Test
    void shouldExposeLowercaseTags() {
        assertEquals("sad", Emotion.SAD.tag());
        assertEquals("happy", Emotion.HAPPY.tag());
        assertEquals("angry", Emotion.ANGRY.tag());
    }
}

package io.drumvoice.test;

import io.drumvoice.api.*;
import io.drumvoice.core.*;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

class VoiceAllocationConfigTest {

    @Test
    void constantsAreInternallyConsistent() {
        assertThatCode(VoiceConstants::validate).doesNotThrowAnyException();
    }

    @Test
    void defaultsComeFromVoiceConstants() {
        VoiceAllocationConfig config = VoiceAllocationConfig.defaults();
        assertThat(config.globalVoiceCeiling()).isEqualTo(32);
        assertThat(config.perPadCeiling()).isEqualTo(4);
        assertThat(config.voiceTimeoutMs()).isEqualTo(30_000L);
        assertThat(config.cleanupIntervalMs()).isEqualTo(1_000L);
        assertThat(config.errorBackoffMs()).isEqualTo(5_000L);
        assertThat(config.oneShotMaxAgeMs()).isEqualTo(5_000L);
        assertThat(config.oneShotCleanupAgeMs()).isEqualTo(10_000L);
        assertThat(config.lowPriorityPressureRatio()).isEqualTo(0.8f);
    }

    @Test
    void builderOverridesIndividualValues() {
        VoiceAllocationConfig config = VoiceAllocationConfig.builder()
            .globalVoiceCeiling(64)
            .perPadCeiling(8)
            .voiceTimeoutMs(10_000)
            .cleanupIntervalMs(250)
            .build();
        assertThat(config.globalVoiceCeiling()).isEqualTo(64);
        assertThat(config.perPadCeiling()).isEqualTo(8);
        assertThat(config.voiceTimeoutMs()).isEqualTo(10_000L);
        assertThat(config.cleanupIntervalMs()).isEqualTo(250L);
        assertThat(config.errorBackoffMs()).isEqualTo(VoiceConstants.DEFAULT_ERROR_BACKOFF_MS);
    }

    @Test
    void nonPositiveCeilingThrows() {
        assertThatThrownBy(() -> VoiceAllocationConfig.builder().globalVoiceCeiling(0).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("globalVoiceCeiling");
        assertThatThrownBy(() -> VoiceAllocationConfig.builder().perPadCeiling(-1).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonPositiveTimingThrows() {
        assertThatThrownBy(() -> VoiceAllocationConfig.builder().voiceTimeoutMs(0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VoiceAllocationConfig.builder().cleanupIntervalMs(0).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void perPadCeilingAboveGlobalThrows() {
        assertThatThrownBy(() -> VoiceAllocationConfig.builder()
                .globalVoiceCeiling(4).perPadCeiling(5).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pressureRatioOutsideUnitIntervalThrows() {
        assertThatThrownBy(() -> VoiceAllocationConfig.builder()
                .lowPriorityPressureRatio(0f).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VoiceAllocationConfig.builder()
                .lowPriorityPressureRatio(1.5f).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatCode(() -> VoiceAllocationConfig.builder()
                .lowPriorityPressureRatio(1f).build())
            .doesNotThrowAnyException();
    }

    // ── VoicePriority ─────────────────────────────────────────────────────

    @Test
    void priorityOrderIsLowToCritical() {
        assertThat(VoicePriority.values()).containsExactly(
            VoicePriority.LOW, VoicePriority.NORMAL, VoicePriority.HIGH, VoicePriority.CRITICAL);
        assertThat(VoicePriority.LOW.isLowerThan(VoicePriority.NORMAL)).isTrue();
        assertThat(VoicePriority.HIGH.isLowerThan(VoicePriority.HIGH)).isFalse();
        assertThat(VoicePriority.CRITICAL.isAtLeast(VoicePriority.HIGH)).isTrue();
        assertThat(VoicePriority.NORMAL.isAtLeast(VoicePriority.HIGH)).isFalse();
    }

    @Test
    void onlyCriticalChangesWhenForwardedToRenderer() {
        assertThat(VoicePriority.CRITICAL.rendererHint()).isEqualTo(VoicePriority.HIGH);
        assertThat(VoicePriority.HIGH.rendererHint()).isEqualTo(VoicePriority.HIGH);
        assertThat(VoicePriority.LOW.rendererHint()).isEqualTo(VoicePriority.LOW);
    }

    // ── SequencerVoice ────────────────────────────────────────────────────

    @Test
    void voiceAgeIsNeverNegative() {
        SequencerVoice voice = new SequencerVoice("v1", "h1", 0, "kick", 1f,
            PlaybackMode.ONE_SHOT, 0, VoicePriority.NORMAL, 5_000L, 1L);
        assertThat(voice.ageMs(7_500L)).isEqualTo(2_500L);
        assertThat(voice.ageMs(4_000L)).isZero();
    }

    @Test
    void voiceWithNegativePadThrows() {
        assertThatThrownBy(() -> new SequencerVoice("v1", "h1", -1, "kick", 1f,
                PlaybackMode.ONE_SHOT, 0, VoicePriority.NORMAL, 0L, 1L))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stealOrderPutsLowestPriorityOldestFirst() {
        SequencerVoice oldNormal = new SequencerVoice("a", "h", 0, "s", 1f,
            PlaybackMode.LOOP, 0, VoicePriority.NORMAL, 100L, 1L);
        SequencerVoice newLow = new SequencerVoice("b", "h", 0, "s", 1f,
            PlaybackMode.LOOP, 0, VoicePriority.LOW, 900L, 2L);
        SequencerVoice oldLow = new SequencerVoice("c", "h", 0, "s", 1f,
            PlaybackMode.LOOP, 0, VoicePriority.LOW, 900L, 0L);

        java.util.List<SequencerVoice> voices =
            new java.util.ArrayList<>(java.util.List.of(oldNormal, newLow, oldLow));
        voices.sort(SequencerVoice.STEAL_ORDER);

        assertThat(voices).containsExactly(oldLow, newLow, oldNormal);
    }
}

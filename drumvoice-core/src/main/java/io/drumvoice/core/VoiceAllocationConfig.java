package io.drumvoice.core;

import io.drumvoice.api.VoiceConstants;

/**
 * Immutable limits and timings for one SequencerVoiceManager.
 *
 * Starts from VoiceConstants defaults. Invalid combinations are rejected in
 * build() with IllegalArgumentException: a manager never starts with a config
 * it cannot honour.
 */
public final class VoiceAllocationConfig {

    private final int globalVoiceCeiling;
    private final int perPadCeiling;
    private final long voiceTimeoutMs;
    private final long cleanupIntervalMs;
    private final long errorBackoffMs;
    private final long oneShotMaxAgeMs;
    private final long oneShotCleanupAgeMs;
    private final float lowPriorityPressureRatio;

    private VoiceAllocationConfig(Builder builder) {
        this.globalVoiceCeiling = builder.globalVoiceCeiling;
        this.perPadCeiling = builder.perPadCeiling;
        this.voiceTimeoutMs = builder.voiceTimeoutMs;
        this.cleanupIntervalMs = builder.cleanupIntervalMs;
        this.errorBackoffMs = builder.errorBackoffMs;
        this.oneShotMaxAgeMs = builder.oneShotMaxAgeMs;
        this.oneShotCleanupAgeMs = builder.oneShotCleanupAgeMs;
        this.lowPriorityPressureRatio = builder.lowPriorityPressureRatio;
    }

    /** Config with every value taken from VoiceConstants. */
    public static VoiceAllocationConfig defaults() {
        return builder().build();
    }

    /** Maximum concurrently tracked voices. */
    public int globalVoiceCeiling() { return globalVoiceCeiling; }

    /** Maximum voices per pad for LOW and NORMAL requests. */
    public int perPadCeiling() { return perPadCeiling; }

    /** Voices at least this old are released by cleanup and optimize(). */
    public long voiceTimeoutMs() { return voiceTimeoutMs; }

    /** Normal cadence of the background cleanup task. */
    public long cleanupIntervalMs() { return cleanupIntervalMs; }

    /** Delay after a failed cleanup cycle before the next one runs. */
    public long errorBackoffMs() { return errorBackoffMs; }

    /** optimize(): ONE_SHOT voices at least this old are released. */
    public long oneShotMaxAgeMs() { return oneShotMaxAgeMs; }

    /** Periodic cleanup: ONE_SHOT voices at least this old are released. */
    public long oneShotCleanupAgeMs() { return oneShotCleanupAgeMs; }

    /** Utilization above which optimize() sheds LOW voices. */
    public float lowPriorityPressureRatio() { return lowPriorityPressureRatio; }

    @Override
    public String toString() {
        return "VoiceAllocationConfig{global=" + globalVoiceCeiling +
            ", perPad=" + perPadCeiling + ", timeoutMs=" + voiceTimeoutMs +
            ", cleanupIntervalMs=" + cleanupIntervalMs + "}";
    }

    // -- Builder --------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private int globalVoiceCeiling = VoiceConstants.DEFAULT_GLOBAL_VOICE_CEILING;
        private int perPadCeiling = VoiceConstants.DEFAULT_PER_PAD_CEILING;
        private long voiceTimeoutMs = VoiceConstants.DEFAULT_VOICE_TIMEOUT_MS;
        private long cleanupIntervalMs = VoiceConstants.DEFAULT_CLEANUP_INTERVAL_MS;
        private long errorBackoffMs = VoiceConstants.DEFAULT_ERROR_BACKOFF_MS;
        private long oneShotMaxAgeMs = VoiceConstants.DEFAULT_ONE_SHOT_MAX_AGE_MS;
        private long oneShotCleanupAgeMs = VoiceConstants.DEFAULT_ONE_SHOT_CLEANUP_AGE_MS;
        private float lowPriorityPressureRatio = VoiceConstants.DEFAULT_LOW_PRIORITY_PRESSURE_RATIO;

        private Builder() {}

        public Builder globalVoiceCeiling(int v) { this.globalVoiceCeiling = v; return this; }
        public Builder perPadCeiling(int v) { this.perPadCeiling = v; return this; }
        public Builder voiceTimeoutMs(long v) { this.voiceTimeoutMs = v; return this; }
        public Builder cleanupIntervalMs(long v) { this.cleanupIntervalMs = v; return this; }
        public Builder errorBackoffMs(long v) { this.errorBackoffMs = v; return this; }
        public Builder oneShotMaxAgeMs(long v) { this.oneShotMaxAgeMs = v; return this; }
        public Builder oneShotCleanupAgeMs(long v) { this.oneShotCleanupAgeMs = v; return this; }
        public Builder lowPriorityPressureRatio(float v) { this.lowPriorityPressureRatio = v; return this; }

        /**
         * @throws IllegalArgumentException if any limit is non-positive, the per-pad
         *         ceiling exceeds the global ceiling, or the pressure ratio is outside (0..1]
         */
        public VoiceAllocationConfig build() {
            requirePositive("globalVoiceCeiling", globalVoiceCeiling);
            requirePositive("perPadCeiling", perPadCeiling);
            requirePositive("voiceTimeoutMs", voiceTimeoutMs);
            requirePositive("cleanupIntervalMs", cleanupIntervalMs);
            requirePositive("errorBackoffMs", errorBackoffMs);
            requirePositive("oneShotMaxAgeMs", oneShotMaxAgeMs);
            requirePositive("oneShotCleanupAgeMs", oneShotCleanupAgeMs);
            if (perPadCeiling > globalVoiceCeiling) {
                throw new IllegalArgumentException(
                    "perPadCeiling " + perPadCeiling +
                    " exceeds globalVoiceCeiling " + globalVoiceCeiling);
            }
            if (!(lowPriorityPressureRatio > 0f && lowPriorityPressureRatio <= 1f)) {
                throw new IllegalArgumentException(
                    "lowPriorityPressureRatio must be in (0..1]; actual = "
                    + lowPriorityPressureRatio);
            }
            return new VoiceAllocationConfig(this);
        }

        private static void requirePositive(String name, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0; actual = " + value);
            }
        }
    }
}

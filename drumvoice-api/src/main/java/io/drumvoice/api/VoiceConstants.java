package io.drumvoice.api;

/**
 * Default voice-allocation limits for the drum sequencer.
 *
 * These are the values a VoiceAllocationConfig starts from. Override per
 * instance through the config builder; do not change them here without
 * re-checking the sequencer's worst-case pattern density.
 */
public final class VoiceConstants {

    private VoiceConstants() {}

    // -- Polyphony ------------------------------------------------------------

    /** Maximum concurrently tracked sequencer voices. */
    public static final int DEFAULT_GLOBAL_VOICE_CEILING = 32;

    /** Maximum voices per pad before a retrigger must steal from itself. */
    public static final int DEFAULT_PER_PAD_CEILING = 4;

    /**
     * Fraction of the global ceiling above which optimize() sheds LOW voices.
     * Must be in (0..1].
     */
    public static final float DEFAULT_LOW_PRIORITY_PRESSURE_RATIO = 0.8f;

    // -- Voice lifetime -------------------------------------------------------

    /** Any voice at least this old is considered stale. */
    public static final long DEFAULT_VOICE_TIMEOUT_MS = 30_000L;

    /** optimize(): ONE_SHOT voices at least this old are assumed finished. */
    public static final long DEFAULT_ONE_SHOT_MAX_AGE_MS = 5_000L;

    /** Periodic cleanup: ONE_SHOT voices at least this old are assumed finished. */
    public static final long DEFAULT_ONE_SHOT_CLEANUP_AGE_MS = 10_000L;

    // -- Background cleanup ---------------------------------------------------

    /** Normal cadence of the background cleanup task. */
    public static final long DEFAULT_CLEANUP_INTERVAL_MS = 1_000L;

    /** Delay before the next cleanup cycle after a cycle failed. */
    public static final long DEFAULT_ERROR_BACKOFF_MS = 5_000L;

    // -- Renderer pool --------------------------------------------------------

    /** Default voice capacity of the sampler's renderer pool. */
    public static final int DEFAULT_RENDERER_VOICES = 16;

    /** A renderer voice must be at least this old to be stolen by an equal-priority request. */
    public static final long SAME_PRIORITY_STEAL_AGE_MS = 1_000L;

    // -- Validation -----------------------------------------------------------

    /**
     * Verifies internal consistency of the defaults.
     * Throws IllegalStateException if any invariant is violated.
     */
    public static void validate() {
        if (DEFAULT_PER_PAD_CEILING > DEFAULT_GLOBAL_VOICE_CEILING) {
            throw new IllegalStateException(
                "DEFAULT_PER_PAD_CEILING exceeds DEFAULT_GLOBAL_VOICE_CEILING");
        }
        if (DEFAULT_LOW_PRIORITY_PRESSURE_RATIO <= 0f
                || DEFAULT_LOW_PRIORITY_PRESSURE_RATIO > 1f) {
            throw new IllegalStateException(
                "DEFAULT_LOW_PRIORITY_PRESSURE_RATIO must be in (0..1]; actual = "
                + DEFAULT_LOW_PRIORITY_PRESSURE_RATIO);
        }
        if (DEFAULT_ONE_SHOT_MAX_AGE_MS > DEFAULT_ONE_SHOT_CLEANUP_AGE_MS) {
            throw new IllegalStateException(
                "optimize() one-shot limit must not exceed the periodic cleanup limit");
        }
        if (DEFAULT_ERROR_BACKOFF_MS < DEFAULT_CLEANUP_INTERVAL_MS) {
            throw new IllegalStateException(
                "DEFAULT_ERROR_BACKOFF_MS must be >= DEFAULT_CLEANUP_INTERVAL_MS");
        }
    }

    static {
        validate();
    }
}

package io.drumvoice.api;

/**
 * Priority tier of a sequencer voice.
 *
 * Used only for comparison: admission control and voice stealing decisions.
 * Never serialized. Ordinal ordering IS the priority ordering:
 * higher ordinal = higher priority. Do NOT reorder these constants.
 *
 * CRITICAL flag behaviour:
 *   - Admission treats CRITICAL exactly like HIGH.
 *   - Forwarded to the renderer as HIGH (see rendererHint()).
 *   - Only observable difference: a CRITICAL request may steal HIGH voices.
 */
public enum VoicePriority {

    /** Background patterns, upcoming steps. First stolen under pressure. */
    LOW,

    /** Default for regular pattern playback. */
    NORMAL,

    /** Current step triggers, important patterns. */
    HIGH,

    /** Real-time user input, system sounds. */
    CRITICAL;

    /** True if this tier ranks at or above {@code other}. */
    public boolean isAtLeast(VoicePriority other) {
        return ordinal() >= other.ordinal();
    }

    /** True if this tier ranks strictly below {@code other}. */
    public boolean isLowerThan(VoicePriority other) {
        return ordinal() < other.ordinal();
    }

    /**
     * Priority forwarded to a VoiceRenderer.
     * Renderers know three tiers of stealability; CRITICAL collapses to HIGH.
     */
    public VoicePriority rendererHint() {
        return this == CRITICAL ? HIGH : this;
    }
}

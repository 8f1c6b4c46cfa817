package io.drumvoice.api;

/**
 * How a triggered sample plays back.
 */
public enum PlaybackMode {

    /** Plays once from start to finish. */
    ONE_SHOT,

    /** Repeats until stopped. */
    LOOP,

    /** Gated: sounds while the pad is held down. */
    GATE,

    /** Sustained: MIDI-style note-on / note-off pair. */
    NOTE_ON_OFF
}

package io.drumvoice.api;

/**
 * Contract with the audio-rendering engine that actually produces sound.
 *
 * The voice manager decides WHETHER a trigger gets a voice; the renderer owns
 * sample playback, mixing and timing. Handles are opaque strings minted by the
 * renderer and handed back verbatim on release.
 *
 * REFUSAL vs FAILURE:
 *   allocate() returns null when the renderer declines (no free voice, sample
 *   not loaded). It throws VoiceRendererException when the renderer itself is
 *   broken or unreachable. Callers treat both as "no voice".
 *
 * VOICES ENDED BY THE RENDERER:
 *   A renderer that can end voices by itself (internal stealing, engine-side stop)
 *   reports each such handle to its VoiceEndedListeners. Renderers whose voices
 *   end only on release() keep the default no-op registration.
 *
 * THREAD SAFETY:
 *   Implementations must tolerate calls from any thread. SequencerVoiceManager
 *   serializes its own calls, but other components may share the renderer.
 */
public interface VoiceRenderer {

    /**
     * Requests a playback voice.
     *
     * @param padIndex     pad that owns the voice; >= 0
     * @param sampleId     opaque sample identifier
     * @param velocity     trigger velocity [0..1]
     * @param mode         playback mode
     * @param priorityHint stealing tier inside the renderer (never CRITICAL)
     * @return renderer handle, or null if the renderer refuses
     * @throws VoiceRendererException if the renderer cannot be reached
     */
    String allocate(int padIndex, String sampleId, float velocity,
                    PlaybackMode mode, VoicePriority priorityHint)
        throws VoiceRendererException;

    /**
     * Stops and frees a voice. Unknown or already-released handles are ignored.
     *
     * @param handle handle previously returned by allocate()
     * @throws VoiceRendererException if the renderer cannot be reached
     */
    void release(String handle) throws VoiceRendererException;

    /** Registers a listener for voices this renderer ends without a release() call. */
    default void addVoiceEndedListener(VoiceEndedListener listener) {}

    default void removeVoiceEndedListener(VoiceEndedListener listener) {}
}

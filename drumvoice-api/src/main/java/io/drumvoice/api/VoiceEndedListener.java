package io.drumvoice.api;

/**
 * Told when a renderer ends a voice on its own: it stole the handle for
 * another trigger, or stopped it from the engine side.
 *
 * Called on the renderer's thread, after the renderer has released its own locks.
 */
@FunctionalInterface
public interface VoiceEndedListener {

    /** @param handle the handle that no longer plays; never reused */
    void onVoiceEnded(String handle);
}

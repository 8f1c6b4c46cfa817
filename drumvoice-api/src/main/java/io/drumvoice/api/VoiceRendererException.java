package io.drumvoice.api;

/**
 * The renderer is broken or unreachable, as opposed to refusing a voice
 * (a refusal is a null handle from VoiceRenderer.allocate).
 */
public final class VoiceRendererException extends Exception {

    public VoiceRendererException(String message) {
        super(message);
    }

    /** Wraps the engine-side failure, e.g. a stalled audio thread or a closed stream. */
    public VoiceRendererException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.drumvoice.core;

/**
 * Observer of aggregate voice-pool state.
 *
 * Registered with SequencerVoiceManager. Called synchronously on the thread that
 * performed the mutation, once the voice table and pad index agree again.
 *
 * Implementations must be quick and must not call back into the manager's
 * mutating operations. Exceptions thrown here are logged and dropped.
 */
@FunctionalInterface
public interface VoiceStateListener {

    /**
     * @param state immutable snapshot taken right after the mutation
     */
    void onVoiceStateChanged(VoiceManagementState state);
}

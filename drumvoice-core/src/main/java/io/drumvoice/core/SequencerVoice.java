package io.drumvoice.core;

import io.drumvoice.api.PlaybackMode;
import io.drumvoice.api.VoicePriority;
import java.util.Comparator;

/**
 * One in-flight triggered sound tracked by SequencerVoiceManager.
 *
 * A voice either exists as ACTIVE in the manager's table or does not exist at all;
 * there is no half-allocated record. Pad, sample and priority never change after
 * creation.
 *
 * IMMUTABLE: safe to hand out to any thread.
 */
public final class SequencerVoice {

    /** Oldest first: creation time, then allocation order. */
    public static final Comparator<SequencerVoice> OLDEST_FIRST =
        Comparator.comparingLong(SequencerVoice::startTimeMs)
                  .thenComparingLong(SequencerVoice::allocationSequence);

    /** Steal order: lowest priority first, oldest first within a tier. */
    public static final Comparator<SequencerVoice> STEAL_ORDER =
        Comparator.comparing(SequencerVoice::priority).thenComparing(OLDEST_FIRST);

    private final String voiceId;
    private final String rendererHandle;
    private final int padIndex;
    private final String sampleId;
    private final float velocity;
    private final PlaybackMode playbackMode;
    private final int stepIndex;
    private final VoicePriority priority;
    private final long startTimeMs;
    private final long allocationSequence;
    private final boolean active;

    /**
     * @param voiceId        manager-assigned id, unique among tracked voices
     * @param rendererHandle handle minted by the VoiceRenderer
     * @param padIndex       owning pad; >= 0
     * @param sampleId       sample that was triggered
     * @param velocity       trigger velocity; clamped to [0..1]
     * @param playbackMode   playback mode
     * @param stepIndex      sequencer step that triggered the voice, -1 for live input
     * @param priority       priority tier
     * @param startTimeMs    creation time in manager clock milliseconds
     * @param allocationSequence monotonically increasing per manager; orders voices
     *                       created within the same millisecond
     */
    public SequencerVoice(String voiceId, String rendererHandle, int padIndex,
                          String sampleId, float velocity, PlaybackMode playbackMode,
                          int stepIndex, VoicePriority priority, long startTimeMs,
                          long allocationSequence) {
        if (voiceId == null) throw new NullPointerException("voiceId");
        if (rendererHandle == null) throw new NullPointerException("rendererHandle");
        if (playbackMode == null) throw new NullPointerException("playbackMode");
        if (priority == null) throw new NullPointerException("priority");
        if (padIndex < 0) {
            throw new IllegalArgumentException("padIndex must be >= 0; actual = " + padIndex);
        }
        this.voiceId = voiceId;
        this.rendererHandle = rendererHandle;
        this.padIndex = padIndex;
        this.sampleId = sampleId;
        this.velocity = clampVelocity(velocity);
        this.playbackMode = playbackMode;
        this.stepIndex = stepIndex;
        this.priority = priority;
        this.startTimeMs = startTimeMs;
        this.allocationSequence = allocationSequence;
        this.active = true;
    }

    public String voiceId() { return voiceId; }
    public String rendererHandle() { return rendererHandle; }
    public int padIndex() { return padIndex; }
    public String sampleId() { return sampleId; }
    public float velocity() { return velocity; }
    public PlaybackMode playbackMode() { return playbackMode; }
    public int stepIndex() { return stepIndex; }
    public VoicePriority priority() { return priority; }
    public long startTimeMs() { return startTimeMs; }
    public long allocationSequence() { return allocationSequence; }
    public boolean isActive() { return active; }

    /** Age in milliseconds relative to {@code nowMs}. Never negative. */
    public long ageMs(long nowMs) {
        return Math.max(0L, nowMs - startTimeMs);
    }

    static float clampVelocity(float velocity) {
        if (Float.isNaN(velocity)) return 0f;
        return Math.max(0f, Math.min(1f, velocity));
    }

    @Override
    public String toString() {
        return "SequencerVoice{id='" + voiceId + "', pad=" + padIndex +
            ", sample='" + sampleId + "', step=" + stepIndex +
            ", priority=" + priority + ", mode=" + playbackMode + "}";
    }
}

package io.drumvoice.core;

import io.drumvoice.api.PlaybackMode;
import io.drumvoice.api.VoicePriority;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time voice usage figures for monitoring overlays.
 *
 * Produced by SequencerVoiceManager.getStatistics(), which never mutates state.
 */
public final class VoiceStatistics {

    private final int totalVoices;
    private final int maxVoices;
    private final Map<VoicePriority, Integer> voicesByPriority;
    private final Map<PlaybackMode, Integer> voicesByPlaybackMode;
    private final long averageVoiceAgeMs;
    private final long oldestVoiceAgeMs;

    public VoiceStatistics(int totalVoices,
                           int maxVoices,
                           Map<VoicePriority, Integer> voicesByPriority,
                           Map<PlaybackMode, Integer> voicesByPlaybackMode,
                           long averageVoiceAgeMs,
                           long oldestVoiceAgeMs) {
        this.totalVoices = totalVoices;
        this.maxVoices = maxVoices;
        this.voicesByPriority = voicesByPriority.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(voicesByPriority));
        this.voicesByPlaybackMode = voicesByPlaybackMode.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(voicesByPlaybackMode));
        this.averageVoiceAgeMs = averageVoiceAgeMs;
        this.oldestVoiceAgeMs = oldestVoiceAgeMs;
    }

    public int totalVoices() { return totalVoices; }
    public int maxVoices() { return maxVoices; }

    /** Active voices as a percentage of the global ceiling [0..100]. */
    public float utilizationPercent() {
        return maxVoices == 0 ? 0f : (totalVoices / (float) maxVoices) * 100f;
    }

    public Map<VoicePriority, Integer> voicesByPriority() { return voicesByPriority; }
    public Map<PlaybackMode, Integer> voicesByPlaybackMode() { return voicesByPlaybackMode; }
    public long averageVoiceAgeMs() { return averageVoiceAgeMs; }
    public long oldestVoiceAgeMs() { return oldestVoiceAgeMs; }

    @Override
    public String toString() {
        return "VoiceStatistics{voices=" + totalVoices + "/" + maxVoices +
            ", utilization=" + utilizationPercent() + "%, byPriority=" + voicesByPriority +
            ", byMode=" + voicesByPlaybackMode + ", avgAgeMs=" + averageVoiceAgeMs +
            ", oldestAgeMs=" + oldestVoiceAgeMs + "}";
    }
}

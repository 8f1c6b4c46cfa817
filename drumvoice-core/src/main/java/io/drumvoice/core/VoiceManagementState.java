package io.drumvoice.core;

import io.drumvoice.api.VoicePriority;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate view of the voice pool, republished after every mutation.
 *
 * Pure function of the voice table at the moment it was taken. Has no identity
 * of its own; observers compare fields, never references.
 *
 * IMMUTABLE: maps are unmodifiable copies.
 */
public final class VoiceManagementState {

    /** Initial state before any voice has been allocated. */
    public static final VoiceManagementState EMPTY = new VoiceManagementState(
        0, 0, Collections.emptyMap(), Collections.emptyMap(), 0L, 0L);

    private final int totalActiveVoices;
    private final int maxVoices;
    private final Map<VoicePriority, Integer> voicesByPriority;
    private final Map<Integer, Integer> voicesByPad;
    private final long averageVoiceAgeMs;
    private final long lastUpdateMs;

    public VoiceManagementState(int totalActiveVoices,
                                int maxVoices,
                                Map<VoicePriority, Integer> voicesByPriority,
                                Map<Integer, Integer> voicesByPad,
                                long averageVoiceAgeMs,
                                long lastUpdateMs) {
        this.totalActiveVoices = totalActiveVoices;
        this.maxVoices = maxVoices;
        this.voicesByPriority = voicesByPriority.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(voicesByPriority));
        this.voicesByPad = Collections.unmodifiableMap(new TreeMap<>(voicesByPad));
        this.averageVoiceAgeMs = averageVoiceAgeMs;
        this.lastUpdateMs = lastUpdateMs;
    }

    public int totalActiveVoices() { return totalActiveVoices; }
    public int maxVoices() { return maxVoices; }

    /** Voice counts keyed by priority. Tiers with no voices are absent. */
    public Map<VoicePriority, Integer> voicesByPriority() { return voicesByPriority; }

    /** Voice counts keyed by pad index, ascending. Pads with no voices are absent. */
    public Map<Integer, Integer> voicesByPad() { return voicesByPad; }

    public long averageVoiceAgeMs() { return averageVoiceAgeMs; }
    public long lastUpdateMs() { return lastUpdateMs; }

    /** Count for one tier; 0 if absent. */
    public int voicesWithPriority(VoicePriority priority) {
        return voicesByPriority.getOrDefault(priority, 0);
    }

    /** Count for one pad; 0 if absent. */
    public int voicesOnPad(int padIndex) {
        return voicesByPad.getOrDefault(padIndex, 0);
    }

    @Override
    public String toString() {
        return "VoiceManagementState{active=" + totalActiveVoices + "/" + maxVoices +
            ", byPriority=" + voicesByPriority + ", byPad=" + voicesByPad +
            ", avgAgeMs=" + averageVoiceAgeMs + "}";
    }
}

package io.drumvoice.dsp;

import io.drumvoice.api.PlaybackMode;
import io.drumvoice.api.VoiceConstants;
import io.drumvoice.api.VoiceEndedListener;
import io.drumvoice.api.VoicePriority;
import io.drumvoice.api.VoiceRenderer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongSupplier;

/**
 * Fixed-capacity pool of sampler voices behind the VoiceRenderer contract.
 *
 * Mirrors the drum engine's own voice slots: each handle stands for one sample
 * playing on one pad. When every slot is taken the pool steals for itself:
 *   - CRITICAL voices are never stolen (callers normally send HIGH instead);
 *   - candidates are ordered by priority, then age, oldest first;
 *   - a lower-priority voice is always stealable;
 *   - an equal-priority voice only once it is older than SAME_PRIORITY_STEAL_AGE_MS;
 *   - higher-priority voices are never stolen.
 *
 * Every handle the pool ends without a release() call (stolen, or stopped through
 * stopVoicesForPad/stopAll) is reported to VoiceEndedListeners, so an owner such as
 * SequencerVoiceManager can drop its record of the voice.
 *
 * THREAD SAFETY: pool state is guarded by the pool monitor. Listeners are called
 * after the monitor is released, so they may call back into the pool or take
 * their own locks.
 */
public final class SamplerVoicePool implements VoiceRenderer {

    private final int capacity;
    private final LongSupplier clockMs;

    /** Live voices in allocation order. */
    private final Map<String, PooledVoice> voices = new LinkedHashMap<>();
    private long nextHandle = 0L;
    private long stolenCount = 0L;

    private final CopyOnWriteArrayList<VoiceEndedListener> endedListeners =
        new CopyOnWriteArrayList<>();

    public SamplerVoicePool() {
        this(VoiceConstants.DEFAULT_RENDERER_VOICES, System::currentTimeMillis);
    }

    /**
     * @param capacity maximum concurrent voices; > 0
     * @param clockMs  millisecond clock used for voice ages
     */
    public SamplerVoicePool(int capacity, LongSupplier clockMs) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("SamplerVoicePool capacity must be > 0");
        }
        if (clockMs == null) throw new NullPointerException("clockMs");
        this.capacity = capacity;
        this.clockMs = clockMs;
    }

    // -- VoiceRenderer --------------------------------------------------------

    @Override
    public String allocate(int padIndex, String sampleId, float velocity,
                           PlaybackMode mode, VoicePriority priorityHint) {
        if (sampleId == null || mode == null) {
            return null;
        }
        VoicePriority priority = (priorityHint == null) ? VoicePriority.NORMAL : priorityHint;
        String stolen = null;
        String handle;
        synchronized (this) {
            long now = clockMs.getAsLong();
            if (voices.size() >= capacity) {
                stolen = stealVoice(priority, now);
                if (stolen == null) {
                    System.err.println("[DrumVoice] SamplerVoicePool: all " + capacity +
                        " voices busy and none can be stolen for pad " + padIndex);
                    return null;
                }
            }
            handle = "voice_" + (nextHandle++) + "_pad_" + padIndex;
            voices.put(handle, new PooledVoice(handle, padIndex, sampleId, priority, now));
        }
        if (stolen != null) {
            fireVoicesEnded(Collections.singletonList(stolen));
        }
        return handle;
    }

    @Override
    public synchronized void release(String handle) {
        if (handle == null) return;
        voices.remove(handle);
    }

    // -- Bulk stop ------------------------------------------------------------

    /**
     * Stops every voice playing on a pad.
     *
     * @return number of voices stopped
     */
    public int stopVoicesForPad(int padIndex) {
        List<String> toStop = new ArrayList<>();
        synchronized (this) {
            for (PooledVoice v : voices.values()) {
                if (v.padIndex == padIndex) toStop.add(v.handle);
            }
            for (String handle : toStop) {
                voices.remove(handle);
            }
        }
        fireVoicesEnded(toStop);
        return toStop.size();
    }

    /**
     * Stops every voice.
     *
     * @return number of voices stopped
     */
    public int stopAll() {
        List<String> toStop;
        synchronized (this) {
            toStop = new ArrayList<>(voices.keySet());
            voices.clear();
        }
        fireVoicesEnded(toStop);
        return toStop.size();
    }

    // -- Voice-ended notification ---------------------------------------------

    @Override
    public void addVoiceEndedListener(VoiceEndedListener listener) {
        if (listener != null) endedListeners.addIfAbsent(listener);
    }

    @Override
    public void removeVoiceEndedListener(VoiceEndedListener listener) {
        endedListeners.remove(listener);
    }

    // -- Queries --------------------------------------------------------------

    public synchronized boolean isPlaying(String handle) {
        return handle != null && voices.containsKey(handle);
    }

    /** Priority the handle was allocated with, or null if not playing. */
    public synchronized VoicePriority priorityOf(String handle) {
        PooledVoice v = (handle == null) ? null : voices.get(handle);
        return v == null ? null : v.priority;
    }

    /** Sample the handle is playing, or null if not playing. */
    public synchronized String sampleOf(String handle) {
        PooledVoice v = (handle == null) ? null : voices.get(handle);
        return v == null ? null : v.sampleId;
    }

    public synchronized int voiceCountForPad(int padIndex) {
        int count = 0;
        for (PooledVoice v : voices.values()) {
            if (v.padIndex == padIndex) count++;
        }
        return count;
    }

    public synchronized int acquiredCount() { return voices.size(); }
    public synchronized int freeCount() { return capacity - voices.size(); }
    public int capacity() { return capacity; }

    /** Voices stolen by this pool to make room for new allocations. */
    public synchronized long stolenCount() { return stolenCount; }

    /** Occupied fraction of the pool [0..1]. */
    public synchronized float utilization() {
        return voices.size() / (float) capacity;
    }

    // -- Internal -------------------------------------------------------------

    /** Removes the best victim and returns its handle, or null if nothing may be stolen. */
    private String stealVoice(VoicePriority requested, long now) {
        PooledVoice victim = null;
        for (PooledVoice v : voices.values()) {
            if (!canSteal(v, requested, now)) continue;
            if (victim == null || isBetterVictim(v, victim)) {
                victim = v;
            }
        }
        if (victim == null) return null;
        voices.remove(victim.handle);
        stolenCount++;
        return victim.handle;
    }

    /** Caller must not hold the pool monitor. */
    private void fireVoicesEnded(List<String> handles) {
        for (String handle : handles) {
            for (VoiceEndedListener l : endedListeners) {
                try {
                    l.onVoiceEnded(handle);
                } catch (Exception e) {
                    System.err.println("[DrumVoice] SamplerVoicePool: voice-ended listener "
                        + "failed for " + handle + " - " + e);
                }
            }
        }
    }

    private static boolean canSteal(PooledVoice v, VoicePriority requested, long now) {
        if (v.priority == VoicePriority.CRITICAL) return false;
        if (v.priority.isLowerThan(requested)) return true;
        if (v.priority == requested) {
            return now - v.startTimeMs > VoiceConstants.SAME_PRIORITY_STEAL_AGE_MS;
        }
        return false;
    }

    /** Lower priority first; within a tier the older voice. Ties keep allocation order. */
    private static boolean isBetterVictim(PooledVoice candidate, PooledVoice current) {
        int byPriority = candidate.priority.compareTo(current.priority);
        if (byPriority != 0) return byPriority < 0;
        return candidate.startTimeMs < current.startTimeMs;
    }

    private static final class PooledVoice {
        final String handle;
        final int padIndex;
        final String sampleId;
        final VoicePriority priority;
        final long startTimeMs;

        PooledVoice(String handle, int padIndex, String sampleId,
                    VoicePriority priority, long startTimeMs) {
            this.handle = handle;
            this.padIndex = padIndex;
            this.sampleId = sampleId;
            this.priority = priority;
            this.startTimeMs = startTimeMs;
        }
    }
}

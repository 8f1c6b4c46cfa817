package io.drumvoice.core;

import io.drumvoice.api.PlaybackMode;
import io.drumvoice.api.VoiceEndedListener;
import io.drumvoice.api.VoicePriority;
import io.drumvoice.api.VoiceRenderer;
import io.drumvoice.api.VoiceRendererException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Admission control and lifecycle tracking for sequencer playback voices.
 *
 * Every pad or step trigger asks for a voice. The manager decides whether the
 * trigger is admitted, steals a voice when the pool is full, and evicts stale
 * voices in the background. Sound itself is produced by the VoiceRenderer;
 * this class only holds the bookkeeping.
 *
 * ADMISSION MODEL:
 *   Global ceiling: once reached, every request must steal (HIGH and CRITICAL
 *     only get a wider choice of victims).
 *   Per-pad ceiling: once reached, LOW and NORMAL requests must steal;
 *     HIGH and CRITICAL are admitted without eviction.
 *   Stealing evicts at most ONE voice per allocation: the oldest voice on the
 *   requesting pad, else the lowest-priority, oldest voice strictly below the
 *   requested priority anywhere. No victim = no voice.
 *
 * RENDERER-ENDED VOICES:
 *   The manager listens for handles the renderer ends on its own (internal
 *   stealing, engine-side stop) and drops the matching voice without calling
 *   release() on the renderer again, so ended voices never hold a ceiling slot.
 *
 * FAILURE MODEL:
 *   Nothing thrown from here reaches the caller. A denied allocation returns null;
 *   a failed release or maintenance pass is logged and otherwise silent.
 *
 * THREAD SAFETY:
 *   All mutations (allocate, release*, optimize, performCleanup, prepare) run under
 *   one manager lock, so the voice table and pad index always change together.
 *   Both structures are concurrent maps, so lock-free reads (getStatistics, counts)
 *   are safe from any thread. The background cleanup runs on its own daemon thread
 *   and takes the same lock.
 *
 * INVARIANT:
 *   Every id in the voice table is in exactly one pad set, every id in a pad set is
 *   in the voice table, and no pad set is empty.
 */
public final class SequencerVoiceManager implements AutoCloseable {

    private static final String LOG_PREFIX = "[DrumVoice] SequencerVoiceManager: ";
    private static final String VOICE_ID_PREFIX = "seq_voice_";

    // -- Collaborators --------------------------------------------------------

    private final VoiceRenderer renderer;
    private final VoiceAllocationConfig config;
    private final LongSupplier clockMs;
    private final VoiceCleanupScheduler cleanupScheduler;
    private final VoiceEndedListener rendererEndedListener = this::onRendererVoiceEnded;

    // -- Voice table and pad index (mutated under lock only) -----------------

    private final Object lock = new Object();
    private final ConcurrentHashMap<String, SequencerVoice> activeVoices =
        new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, Set<String>> voicesByPad =
        new ConcurrentHashMap<>();
    private final AtomicLong voiceIdSequence = new AtomicLong(0L);

    // -- Observers ------------------------------------------------------------

    private final CopyOnWriteArrayList<VoiceStateListener> listeners =
        new CopyOnWriteArrayList<>();
    private volatile VoiceManagementState voiceState = VoiceManagementState.EMPTY;

    // -- Counters (read by monitoring overlays) -------------------------------

    private final AtomicLong allocationCount = new AtomicLong(0L);
    private final AtomicLong deniedCount = new AtomicLong(0L);
    private final AtomicLong stolenCount = new AtomicLong(0L);
    private final AtomicLong rendererFailureCount = new AtomicLong(0L);
    private final AtomicLong rendererEndedCount = new AtomicLong(0L);

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    // -- Construction ---------------------------------------------------------

    /** Manager with VoiceConstants defaults and the system clock. */
    public SequencerVoiceManager(VoiceRenderer renderer) {
        this(renderer, VoiceAllocationConfig.defaults());
    }

    public SequencerVoiceManager(VoiceRenderer renderer, VoiceAllocationConfig config) {
        this(renderer, config, System::currentTimeMillis);
    }

    /**
     * @param renderer produces sound for admitted voices
     * @param config   limits and timings
     * @param clockMs  millisecond clock used for voice ages
     */
    public SequencerVoiceManager(VoiceRenderer renderer, VoiceAllocationConfig config,
                                 LongSupplier clockMs) {
        if (renderer == null) throw new NullPointerException("renderer");
        if (config == null) throw new NullPointerException("config");
        if (clockMs == null) throw new NullPointerException("clockMs");
        this.renderer = renderer;
        this.config = config;
        this.clockMs = clockMs;
        this.cleanupScheduler = new VoiceCleanupScheduler(
            this::runScheduledCleanup,
            config.cleanupIntervalMs(),
            config.errorBackoffMs(),
            "drumvoice-cleanup");
        renderer.addVoiceEndedListener(rendererEndedListener);
    }

    // -- Lifecycle ------------------------------------------------------------

    /** Starts the periodic cleanup. No-op if already running or shut down. */
    public void initialize() {
        if (shutdown.get()) {
            warn("initialize() after shutdown ignored");
            return;
        }
        cleanupScheduler.start();
    }

    /**
     * Stops the periodic cleanup, then releases every voice.
     * Idempotent. A shut-down manager denies all further allocations.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) return;
        cleanupScheduler.stop();
        releaseAll();
        renderer.removeVoiceEndedListener(rendererEndedListener);
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutdown() { return shutdown.get(); }

    /** True while the background cleanup task is scheduled. */
    public boolean isCleanupRunning() { return cleanupScheduler.isRunning(); }

    // -- Allocation -----------------------------------------------------------

    /** Allocates with NORMAL priority. */
    public String allocate(int padIndex, String sampleId, float velocity,
                           PlaybackMode playbackMode, int stepIndex) {
        return allocate(padIndex, sampleId, velocity, playbackMode, stepIndex,
                        VoicePriority.NORMAL);
    }

    /**
     * Admits, steals for, or denies a trigger.
     *
     * The renderer is asked for a handle only once the trigger is admitted. If it
     * refuses or fails, no local state is created.
     *
     * @param padIndex     owning pad; >= 0
     * @param sampleId     sample to play
     * @param velocity     trigger velocity; clamped to [0..1]
     * @param playbackMode playback mode
     * @param stepIndex    sequencer step for traceability; -1 for live input
     * @param priority     priority tier
     * @return voice id, or null if no voice could be allocated
     */
    public String allocate(int padIndex, String sampleId, float velocity,
                           PlaybackMode playbackMode, int stepIndex,
                           VoicePriority priority) {
        if (padIndex < 0 || sampleId == null || playbackMode == null || priority == null) {
            deniedCount.incrementAndGet();
            warn("rejected allocation with invalid arguments (pad=" + padIndex +
                 ", sample=" + sampleId + ", mode=" + playbackMode +
                 ", priority=" + priority + ")");
            return null;
        }
        if (shutdown.get()) {
            deniedCount.incrementAndGet();
            return null;
        }

        synchronized (lock) {
            String handle = null;
            try {
                if (!canAllocate(padIndex, priority) && !stealVoice(padIndex, priority)) {
                    deniedCount.incrementAndGet();
                    warn("voice limit reached and nothing to steal for pad " + padIndex +
                         " (" + priority + ", " + activeVoices.size() + "/" +
                         config.globalVoiceCeiling() + " active)");
                    return null;
                }

                float clampedVelocity = SequencerVoice.clampVelocity(velocity);
                handle = requestRendererVoice(padIndex, sampleId, clampedVelocity,
                                              playbackMode, priority);
                if (handle == null) {
                    deniedCount.incrementAndGet();
                    return null;
                }

                long sequence = voiceIdSequence.incrementAndGet();
                long now = clockMs.getAsLong();
                String voiceId = VOICE_ID_PREFIX + sequence + "_" + now;
                SequencerVoice voice = new SequencerVoice(
                    voiceId, handle, padIndex, sampleId, clampedVelocity,
                    playbackMode, stepIndex, priority, now, sequence);

                activeVoices.put(voiceId, voice);
                voicesByPad.computeIfAbsent(padIndex, k -> ConcurrentHashMap.newKeySet())
                           .add(voiceId);
                allocationCount.incrementAndGet();
                publishState();
                return voiceId;

            } catch (RuntimeException e) {
                deniedCount.incrementAndGet();
                error("error allocating voice for pad " + padIndex, e);
                if (handle != null) {
                    releaseRendererHandle(handle);
                }
                return null;
            }
        }
    }

    /**
     * Admission check without eviction.
     *
     * @return true if a voice for this pad and priority fits without stealing
     */
    public boolean canAllocate(int padIndex, VoicePriority priority) {
        if (priority == null) return false;
        if (activeVoices.size() >= config.globalVoiceCeiling()) {
            return false;
        }
        if (voiceCountForPad(padIndex) >= config.perPadCeiling()) {
            return priority.isAtLeast(VoicePriority.HIGH);
        }
        return true;
    }

    // -- Release --------------------------------------------------------------

    /**
     * Releases one voice. Unknown or already-released ids are ignored.
     */
    public void release(String voiceId) {
        if (voiceId == null) return;
        synchronized (lock) {
            try {
                if (releaseLocked(voiceId)) {
                    publishState();
                }
            } catch (RuntimeException e) {
                error("error releasing voice " + voiceId, e);
            }
        }
    }

    /**
     * Releases every voice owned by a pad.
     *
     * @return number of voices released
     */
    public int releaseAllForPad(int padIndex) {
        synchronized (lock) {
            int released = 0;
            try {
                released = releasePadLocked(padIndex);
            } catch (RuntimeException e) {
                error("error releasing voices for pad " + padIndex, e);
            }
            if (released > 0) publishState();
            return released;
        }
    }

    /**
     * Releases every tracked voice. Used for panic and on shutdown.
     *
     * @return number of voices released
     */
    public int releaseAll() {
        synchronized (lock) {
            int released = 0;
            try {
                for (String voiceId : new ArrayList<>(activeVoices.keySet())) {
                    if (releaseLocked(voiceId)) released++;
                }
            } catch (RuntimeException e) {
                error("error releasing all voices", e);
            }
            if (released > 0) publishState();
            return released;
        }
    }

    // -- Maintenance ----------------------------------------------------------

    /**
     * Proactive maintenance pass. Releases:
     *   - voices at least voiceTimeoutMs old;
     *   - every LOW voice while utilization is above lowPriorityPressureRatio;
     *   - ONE_SHOT voices at least oneShotMaxAgeMs old.
     *
     * @return number of voices released
     */
    public int optimize() {
        synchronized (lock) {
            try {
                long now = clockMs.getAsLong();
                boolean underPressure = activeVoices.size()
                    > config.globalVoiceCeiling() * config.lowPriorityPressureRatio();
                List<String> toRelease = new ArrayList<>();
                for (SequencerVoice voice : activeVoices.values()) {
                    long age = voice.ageMs(now);
                    if (age >= config.voiceTimeoutMs()
                            || (underPressure && voice.priority() == VoicePriority.LOW)
                            || (voice.playbackMode() == PlaybackMode.ONE_SHOT
                                && age >= config.oneShotMaxAgeMs())) {
                        toRelease.add(voice.voiceId());
                    }
                }
                return releaseBatchLocked(toRelease);
            } catch (RuntimeException e) {
                error("error optimizing voice allocation", e);
                return 0;
            }
        }
    }

    /**
     * The periodic cleanup pass. Releases voices at least voiceTimeoutMs old and
     * ONE_SHOT voices at least oneShotCleanupAgeMs old.
     *
     * @return number of voices released
     */
    public int performCleanup() {
        try {
            return cleanupPass();
        } catch (RuntimeException e) {
            error("error in voice cleanup", e);
            return 0;
        }
    }

    /**
     * Reconciles tracked voices with a new pad-to-sample assignment.
     *
     * Releases every voice on pads missing from padSampleMap, then trims each
     * remaining pad to maxPolyphonyPerPad by releasing its oldest voices.
     *
     * @return number of voices released
     */
    public int prepareForPatternPlayback(Map<Integer, String> padSampleMap,
                                         int maxPolyphonyPerPad) {
        if (padSampleMap == null) {
            warn("prepareForPatternPlayback() called with null sample map - ignored");
            return 0;
        }
        int limit = Math.max(0, maxPolyphonyPerPad);
        synchronized (lock) {
            int released = 0;
            try {
                Set<Integer> unassigned = new HashSet<>(voicesByPad.keySet());
                unassigned.removeAll(padSampleMap.keySet());
                for (Integer padIndex : unassigned) {
                    released += releasePadLocked(padIndex);
                }

                for (Integer padIndex : new ArrayList<>(voicesByPad.keySet())) {
                    List<SequencerVoice> padVoices = voicesOnPadLocked(padIndex);
                    int excess = padVoices.size() - limit;
                    if (excess <= 0) continue;
                    padVoices.sort(SequencerVoice.OLDEST_FIRST);
                    for (int i = 0; i < excess; i++) {
                        if (releaseLocked(padVoices.get(i).voiceId())) released++;
                    }
                }
            } catch (RuntimeException e) {
                error("error preparing for pattern playback", e);
            }
            if (released > 0) publishState();
            return released;
        }
    }

    /** Reconciles using the configured per-pad ceiling. */
    public int prepareForPatternPlayback(Map<Integer, String> padSampleMap) {
        return prepareForPatternPlayback(padSampleMap, config.perPadCeiling());
    }

    // -- Queries --------------------------------------------------------------

    /** Usage figures. Pure read - never mutates state. */
    public VoiceStatistics getStatistics() {
        long now = clockMs.getAsLong();
        List<SequencerVoice> voices = new ArrayList<>(activeVoices.values());
        Map<VoicePriority, Integer> byPriority = new EnumMap<>(VoicePriority.class);
        Map<PlaybackMode, Integer> byMode = new EnumMap<>(PlaybackMode.class);
        long totalAge = 0L;
        long oldest = 0L;
        for (SequencerVoice voice : voices) {
            byPriority.merge(voice.priority(), 1, Integer::sum);
            byMode.merge(voice.playbackMode(), 1, Integer::sum);
            long age = voice.ageMs(now);
            totalAge += age;
            oldest = Math.max(oldest, age);
        }
        long averageAge = voices.isEmpty() ? 0L : totalAge / voices.size();
        return new VoiceStatistics(voices.size(), config.globalVoiceCeiling(),
                                   byPriority, byMode, averageAge, oldest);
    }

    /** Latest aggregate snapshot. Republished after every mutation. */
    public VoiceManagementState voiceState() { return voiceState; }

    public int activeVoiceCount() { return activeVoices.size(); }

    public int voiceCountForPad(int padIndex) {
        Set<String> ids = voicesByPad.get(padIndex);
        return ids == null ? 0 : ids.size();
    }

    /** Returns the tracked voice, or null if unknown or released. */
    public SequencerVoice getVoice(String voiceId) {
        return voiceId == null ? null : activeVoices.get(voiceId);
    }

    /** Copy of the tracked voice ids. */
    public Set<String> activeVoiceIds() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(activeVoices.keySet()));
        }
    }

    /** Consistent copy of the pad-to-voice index, taken under the manager lock. */
    public Map<Integer, Set<String>> padVoiceIndex() {
        synchronized (lock) {
            Map<Integer, Set<String>> copy = new HashMap<>();
            voicesByPad.forEach((pad, ids) ->
                copy.put(pad, Collections.unmodifiableSet(new LinkedHashSet<>(ids))));
            return Collections.unmodifiableMap(copy);
        }
    }

    public VoiceAllocationConfig config() { return config; }

    // -- Listener management --------------------------------------------------

    public void addListener(VoiceStateListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(VoiceStateListener listener) {
        listeners.remove(listener);
    }

    // -- Counters -------------------------------------------------------------

    /** Voices successfully allocated since construction. */
    public long allocationCount() { return allocationCount.get(); }

    /** Allocation requests that returned null. */
    public long deniedCount() { return deniedCount.get(); }

    /** Voices evicted by allocation-time stealing. */
    public long stolenCount() { return stolenCount.get(); }

    /** Renderer calls that threw. */
    public long rendererFailureCount() { return rendererFailureCount.get(); }

    /** Voices dropped because the renderer ended their handle itself. */
    public long rendererEndedCount() { return rendererEndedCount.get(); }

    /** Background cleanup cycles that failed and triggered the error backoff. */
    public long failedCleanupCycles() { return cleanupScheduler.failedCycles(); }

    // -- Internal: stealing ---------------------------------------------------

    /** Evicts at most one voice. Caller holds the lock. */
    private boolean stealVoice(int padIndex, VoicePriority requested) {
        SequencerVoice victim = null;
        for (SequencerVoice voice : voicesOnPadLocked(padIndex)) {
            if (victim == null || SequencerVoice.OLDEST_FIRST.compare(voice, victim) < 0) {
                victim = voice;
            }
        }
        if (victim == null) {
            for (SequencerVoice voice : activeVoices.values()) {
                if (!voice.priority().isLowerThan(requested)) continue;
                if (victim == null || SequencerVoice.STEAL_ORDER.compare(voice, victim) < 0) {
                    victim = voice;
                }
            }
        }
        if (victim == null) return false;

        releaseLocked(victim.voiceId());
        stolenCount.incrementAndGet();
        return true;
    }

    // -- Internal: table mutation (caller holds the lock) --------------------

    private boolean releaseLocked(String voiceId) {
        SequencerVoice voice = forgetLocked(voiceId);
        if (voice == null) return false;
        releaseRendererHandle(voice.rendererHandle());
        return true;
    }

    /** Removes a voice from the table and pad index only. Returns it, or null if untracked. */
    private SequencerVoice forgetLocked(String voiceId) {
        SequencerVoice voice = activeVoices.remove(voiceId);
        if (voice == null) return null;

        int padIndex = voice.padIndex();
        Set<String> padVoices = voicesByPad.get(padIndex);
        if (padVoices == null || !padVoices.remove(voiceId)) {
            warn("pad index out of sync: voice " + voiceId + " missing from pad " + padIndex);
        }
        if (padVoices != null && padVoices.isEmpty()) {
            voicesByPad.remove(padIndex);
        }
        return voice;
    }

    private int releasePadLocked(int padIndex) {
        Set<String> padVoices = voicesByPad.get(padIndex);
        if (padVoices == null) return 0;
        int released = 0;
        for (String voiceId : new ArrayList<>(padVoices)) {
            if (releaseLocked(voiceId)) released++;
        }
        return released;
    }

    private int releaseBatchLocked(List<String> voiceIds) {
        int released = 0;
        for (String voiceId : voiceIds) {
            if (releaseLocked(voiceId)) released++;
        }
        if (released > 0) publishState();
        return released;
    }

    private List<SequencerVoice> voicesOnPadLocked(int padIndex) {
        Set<String> ids = voicesByPad.get(padIndex);
        if (ids == null) return new ArrayList<>();
        List<SequencerVoice> voices = new ArrayList<>(ids.size());
        for (String id : ids) {
            SequencerVoice voice = activeVoices.get(id);
            if (voice != null) voices.add(voice);
        }
        return voices;
    }

    // -- Internal: cleanup ----------------------------------------------------

    /** Throws on failure so the scheduler can back off. */
    private int cleanupPass() {
        synchronized (lock) {
            long now = clockMs.getAsLong();
            List<String> toRelease = new ArrayList<>();
            for (SequencerVoice voice : activeVoices.values()) {
                long age = voice.ageMs(now);
                if (age >= config.voiceTimeoutMs()
                        || (voice.playbackMode() == PlaybackMode.ONE_SHOT
                            && age >= config.oneShotCleanupAgeMs())) {
                    toRelease.add(voice.voiceId());
                }
            }
            return releaseBatchLocked(toRelease);
        }
    }

    private void runScheduledCleanup() {
        cleanupPass();
    }

    // -- Internal: renderer ---------------------------------------------------

    private void onRendererVoiceEnded(String handle) {
        if (handle == null) return;
        synchronized (lock) {
            try {
                for (SequencerVoice voice : activeVoices.values()) {
                    if (handle.equals(voice.rendererHandle())) {
                        forgetLocked(voice.voiceId());
                        rendererEndedCount.incrementAndGet();
                        publishState();
                        return;
                    }
                }
            } catch (RuntimeException e) {
                error("error dropping voice ended by renderer (" + handle + ")", e);
            }
        }
    }

    private String requestRendererVoice(int padIndex, String sampleId, float velocity,
                                        PlaybackMode mode, VoicePriority priority) {
        try {
            String handle = renderer.allocate(padIndex, sampleId, velocity, mode,
                                              priority.rendererHint());
            if (handle == null) {
                warn("renderer refused voice for pad " + padIndex + " (sample " + sampleId + ")");
            }
            return handle;
        } catch (VoiceRendererException | RuntimeException e) {
            rendererFailureCount.incrementAndGet();
            error("renderer unavailable allocating voice for pad " + padIndex, e);
            return null;
        }
    }

    private void releaseRendererHandle(String handle) {
        try {
            renderer.release(handle);
        } catch (VoiceRendererException | RuntimeException e) {
            rendererFailureCount.incrementAndGet();
            error("renderer failed to release handle " + handle, e);
        }
    }

    // -- Internal: state publication ------------------------------------------

    /** Rebuilds the aggregate snapshot and notifies listeners. Caller holds the lock. */
    private void publishState() {
        long now = clockMs.getAsLong();
        Map<VoicePriority, Integer> byPriority = new EnumMap<>(VoicePriority.class);
        long totalAge = 0L;
        for (SequencerVoice voice : activeVoices.values()) {
            byPriority.merge(voice.priority(), 1, Integer::sum);
            totalAge += voice.ageMs(now);
        }
        Map<Integer, Integer> byPad = new HashMap<>();
        voicesByPad.forEach((pad, ids) -> byPad.put(pad, ids.size()));
        int total = activeVoices.size();

        VoiceManagementState state = new VoiceManagementState(
            total, config.globalVoiceCeiling(), byPriority, byPad,
            total == 0 ? 0L : totalAge / total, now);
        voiceState = state;

        for (VoiceStateListener l : listeners) {
            try {
                l.onVoiceStateChanged(state);
            } catch (Exception e) {
                error("voice state listener failed", e);
            }
        }
    }

    // -- Logging --------------------------------------------------------------

    private static void warn(String message) {
        System.err.println(LOG_PREFIX + message);
    }

    private static void error(String message, Throwable cause) {
        System.err.println(LOG_PREFIX + message + " - " + cause);
    }
}

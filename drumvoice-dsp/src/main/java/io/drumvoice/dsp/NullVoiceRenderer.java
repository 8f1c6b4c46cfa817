package io.drumvoice.dsp;

import io.drumvoice.api.PlaybackMode;
import io.drumvoice.api.VoicePriority;
import io.drumvoice.api.VoiceRenderer;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * No-op VoiceRenderer for headless runs and tests.
 *
 * Grants every request with a fresh handle and produces no sound. Tracks live
 * handles so callers can verify that every granted handle is eventually released.
 */
public final class NullVoiceRenderer implements VoiceRenderer {

    private final AtomicLong handleSequence = new AtomicLong(0L);
    private final AtomicLong allocateCalls = new AtomicLong(0L);
    private final AtomicLong releaseCalls = new AtomicLong(0L);
    private final Set<String> liveHandles = ConcurrentHashMap.newKeySet();

    @Override
    public String allocate(int padIndex, String sampleId, float velocity,
                           PlaybackMode mode, VoicePriority priorityHint) {
        allocateCalls.incrementAndGet();
        String handle = "null_voice_" + handleSequence.incrementAndGet() + "_pad_" + padIndex;
        liveHandles.add(handle);
        return handle;
    }

    @Override
    public void release(String handle) {
        releaseCalls.incrementAndGet();
        if (handle != null) liveHandles.remove(handle);
    }

    public long allocateCalls() { return allocateCalls.get(); }
    public long releaseCalls() { return releaseCalls.get(); }

    /** Handles granted and not yet released. */
    public int liveHandleCount() { return liveHandles.size(); }

    public boolean isLive(String handle) {
        return handle != null && liveHandles.contains(handle);
    }
}

package com.switchboard.core.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Pause switch for the whole swarm or for individual supervisors.
 * <p>
 * Paused supervisors answer every task with a BLOCKED report and the transport holds messages
 * addressed to them until they resume. Resume listeners are told which unit came back, or
 * {@code null} for a global resume.
 */
@Service
public class SwarmControl {

    private static final Logger log = LoggerFactory.getLogger(SwarmControl.class);

    private final AtomicBoolean globallyPaused = new AtomicBoolean(false);
    private final Set<String> pausedUnits = ConcurrentHashMap.newKeySet();
    private final CopyOnWriteArrayList<Consumer<String>> resumeListeners = new CopyOnWriteArrayList<>();

    public void pauseAll(String reason) {
        if (globallyPaused.compareAndSet(false, true)) {
            log.warn("Swarm paused: {}", reason);
        }
    }

    public void resumeAll() {
        if (globallyPaused.compareAndSet(true, false)) {
            log.info("Swarm resumed");
            notifyResumed(null);
        }
    }

    public void pause(String unitId, String reason) {
        if (pausedUnits.add(unitId)) {
            log.warn("Unit {} paused: {}", unitId, reason);
        }
    }

    public void resume(String unitId) {
        if (pausedUnits.remove(unitId)) {
            log.info("Unit {} resumed", unitId);
            notifyResumed(unitId);
        }
    }

    public boolean isPaused(String unitId) {
        return globallyPaused.get() || pausedUnits.contains(unitId);
    }

    public boolean isGloballyPaused() {
        return globallyPaused.get();
    }

    public void onResume(Consumer<String> listener) {
        resumeListeners.add(listener);
    }

    private void notifyResumed(String unitId) {
        for (Consumer<String> listener : resumeListeners) {
            try {
                listener.accept(unitId);
            } catch (Exception e) {
                log.warn("Resume listener failed for {}: {}", unitId, e.getMessage(), e);
            }
        }
    }
}

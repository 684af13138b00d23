package com.securityops.coordination.service.alert;

import com.securityops.coordination.dto.EmergencyAlertView;
import com.securityops.coordination.exception.StateConflictException;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Live state of one alert: the current snapshot plus the pending escalation timer.
 *
 * Snapshots are immutable and replaced by compare-and-set, so timer callbacks and user actions
 * on the same alert never interleave inside a transition.
 */
class AlertHandle {

    private final AtomicReference<EmergencyAlertView> state;
    private final AtomicReference<ScheduledFuture<?>> pendingTimer = new AtomicReference<>();

    AlertHandle(EmergencyAlertView initial) {
        this.state = new AtomicReference<>(initial);
    }

    EmergencyAlertView current() {
        return state.get();
    }

    /**
     * Applies a transition atomically. The function may throw {@link StateConflictException}
     * when the current state does not allow it; the state is then left untouched.
     */
    Transition transition(UnaryOperator<EmergencyAlertView> change) {
        while (true) {
            EmergencyAlertView before = state.get();
            EmergencyAlertView after = change.apply(before);
            if (state.compareAndSet(before, after)) {
                return new Transition(before, after);
            }
        }
    }

    void replaceTimer(ScheduledFuture<?> timer) {
        ScheduledFuture<?> previous = pendingTimer.getAndSet(timer);
        if (previous != null && previous != timer) {
            previous.cancel(false);
        }
    }

    void cancelTimer() {
        ScheduledFuture<?> timer = pendingTimer.getAndSet(null);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    boolean hasPendingTimer() {
        ScheduledFuture<?> timer = pendingTimer.get();
        return timer != null && !timer.isDone();
    }

    record Transition(EmergencyAlertView before, EmergencyAlertView after) {
    }
}

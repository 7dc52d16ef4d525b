package com.codetracker.tracking;

import com.codetracker.model.TimePeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

public class TrackerEvents {

    private static final Logger log = LoggerFactory.getLogger(TrackerEvents.class);

    private final List<ActivityListener> activityListeners = new CopyOnWriteArrayList<>();
    private final List<PeriodResetListener> periodResetListeners = new CopyOnWriteArrayList<>();

    public void addActivityListener(ActivityListener listener) {
        activityListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeActivityListener(ActivityListener listener) {
        activityListeners.remove(listener);
    }

    public void addPeriodResetListener(PeriodResetListener listener) {
        periodResetListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removePeriodResetListener(PeriodResetListener listener) {
        periodResetListeners.remove(listener);
    }

    void fireActivityStarted() {
        for (ActivityListener listener : activityListeners) {
            try {
                listener.onActivityStarted();
            } catch (RuntimeException ex) {
                log.error("Activity listener failed on start notification", ex);
            }
        }
    }

    void fireActivityStopped() {
        for (ActivityListener listener : activityListeners) {
            try {
                listener.onActivityStopped();
            } catch (RuntimeException ex) {
                log.error("Activity listener failed on stop notification", ex);
            }
        }
    }

    void firePeriodReset(TimePeriod period) {
        for (PeriodResetListener listener : periodResetListeners) {
            try {
                listener.onPeriodReset(period);
            } catch (RuntimeException ex) {
                log.error("Period reset listener failed for {}", period, ex);
            }
        }
    }
}

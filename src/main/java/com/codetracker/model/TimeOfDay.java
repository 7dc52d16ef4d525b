package com.codetracker.model;

import java.time.LocalTime;

public enum TimeOfDay {
    NIGHT(0),
    MORNING(6),
    DAYTIME(12),
    EVENING(18);

    private final int startHour;

    TimeOfDay(int startHour) {
        this.startHour = startHour;
    }

    public int startHour() {
        return startHour;
    }

    public static TimeOfDay of(LocalTime time) {
        int hour = time.getHour();
        if (hour < 6) {
            return NIGHT;
        }
        if (hour < 12) {
            return MORNING;
        }
        if (hour < 18) {
            return DAYTIME;
        }
        return EVENING;
    }
}

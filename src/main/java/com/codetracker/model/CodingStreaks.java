package com.codetracker.model;

public record CodingStreaks(int currentStreak, int maxStreak) {

    public static final CodingStreaks NONE = new CodingStreaks(0, 0);

    public CodingStreaks {
        if (currentStreak < 0 || maxStreak < 0) {
            throw new IllegalArgumentException("streaks must be >= 0");
        }
    }
}

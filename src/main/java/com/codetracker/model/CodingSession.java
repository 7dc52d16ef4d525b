package com.codetracker.model;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

public record CodingSession(
        String sessionUuid,
        String userId,
        String projectName,
        String language,
        String platform,
        String ideName,
        LocalDateTime startTime,
        LocalDateTime endTime,
        LocalDateTime lastModified,
        boolean deleted,
        boolean synced,
        Optional<LocalDateTime> syncedAt,
        int syncVersion
) {

    public CodingSession {
        Objects.requireNonNull(sessionUuid, "sessionUuid");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(projectName, "projectName");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(ideName, "ideName");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
        Objects.requireNonNull(lastModified, "lastModified");
        Objects.requireNonNull(syncedAt, "syncedAt");
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime " + endTime + " is before startTime " + startTime);
        }
        if (syncVersion < 0) {
            throw new IllegalArgumentException("syncVersion must be >= 0");
        }
    }

    public static CodingSession create(String sessionUuid,
                                       String userId,
                                       String projectName,
                                       String language,
                                       String platform,
                                       String ideName,
                                       LocalDateTime startTime,
                                       LocalDateTime endTime,
                                       LocalDateTime lastModified) {
        return new CodingSession(sessionUuid, userId, projectName, language, platform, ideName,
                startTime, endTime, lastModified, false, false, Optional.empty(), 0);
    }

    public long durationSeconds() {
        return ChronoUnit.SECONDS.between(startTime, endTime);
    }

    public SessionTimeRange timeRange() {
        return new SessionTimeRange(startTime, endTime);
    }
}

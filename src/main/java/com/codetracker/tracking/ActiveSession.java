package com.codetracker.tracking;

import com.codetracker.model.CodingSession;

import java.time.LocalDateTime;

// only touched under the tracker's index lock
final class ActiveSession {

    private final String sessionUuid;
    private final String projectKey;
    private final String projectName;
    private final String language;
    private final LocalDateTime startTime;
    private LocalDateTime lastTouch;

    ActiveSession(String sessionUuid, String projectKey, String projectName, String language, LocalDateTime startTime) {
        this.sessionUuid = sessionUuid;
        this.projectKey = projectKey;
        this.projectName = projectName;
        this.language = language;
        this.startTime = startTime;
        this.lastTouch = startTime;
    }

    void touch(LocalDateTime now) {
        if (now.isAfter(lastTouch)) {
            lastTouch = now;
        }
    }

    LocalDateTime lastTouch() {
        return lastTouch;
    }

    String language() {
        return language;
    }

    /**
     * The session as persisted with the given end, which is moved up to the start if it lies before it.
     */
    CodingSession toCodingSession(SessionContext context, LocalDateTime end, LocalDateTime lastModified) {
        LocalDateTime effectiveEnd = end.isBefore(startTime) ? startTime : end;
        return CodingSession.create(sessionUuid, context.userId(), projectName, language,
                context.platform(), context.ideName(), startTime, effectiveEnd, lastModified);
    }

    LiveSession view() {
        return new LiveSession(projectKey, projectName, language, startTime, lastTouch);
    }
}

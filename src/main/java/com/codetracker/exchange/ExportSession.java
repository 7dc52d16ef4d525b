package com.codetracker.exchange;

import com.codetracker.model.CodingSession;
import com.codetracker.util.Timestamps;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record ExportSession(
        String sessionUuid,
        String userId,
        String projectName,
        String language,
        String platform,
        String ideName,
        String startTime,
        String endTime,
        String lastModified
) {

    @JsonCreator
    public ExportSession(
            @JsonProperty("sessionUuid") String sessionUuid,
            @JsonProperty("userId") String userId,
            @JsonProperty("projectName") String projectName,
            @JsonProperty("language") String language,
            @JsonProperty("platform") String platform,
            @JsonProperty("ideName") String ideName,
            @JsonProperty("startTime") String startTime,
            @JsonProperty("endTime") String endTime,
            @JsonProperty("lastModified") String lastModified
    ) {
        this.sessionUuid = Objects.requireNonNull(sessionUuid, "sessionUuid");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.projectName = Objects.requireNonNull(projectName, "projectName");
        this.language = Objects.requireNonNull(language, "language");
        this.platform = platform == null ? "" : platform;
        this.ideName = ideName == null ? "" : ideName;
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.endTime = Objects.requireNonNull(endTime, "endTime");
        this.lastModified = lastModified == null ? endTime : lastModified;
    }

    public static ExportSession from(CodingSession session) {
        return new ExportSession(
                session.sessionUuid(),
                session.userId(),
                session.projectName(),
                session.language(),
                session.platform(),
                session.ideName(),
                Timestamps.format(session.startTime()),
                Timestamps.format(session.endTime()),
                Timestamps.format(session.lastModified()));
    }

    public CodingSession toCodingSession() {
        return CodingSession.create(
                sessionUuid,
                userId,
                projectName,
                language,
                platform,
                ideName,
                Timestamps.parse(startTime),
                Timestamps.parse(endTime),
                Timestamps.parse(lastModified));
    }
}

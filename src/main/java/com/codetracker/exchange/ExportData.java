package com.codetracker.exchange;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public record ExportData(
        String exportVersion,
        String exportTime,
        int totalSessions,
        List<ExportSession> sessions
) {

    public static final String CURRENT_VERSION = "1.0";

    @JsonCreator
    public ExportData(
            @JsonProperty("exportVersion") String exportVersion,
            @JsonProperty("exportTime") String exportTime,
            @JsonProperty("totalSessions") int totalSessions,
            @JsonProperty("sessions") List<ExportSession> sessions
    ) {
        this.exportVersion = Objects.requireNonNull(exportVersion, "exportVersion");
        this.exportTime = exportTime == null ? "" : exportTime;
        this.totalSessions = totalSessions;
        this.sessions = sessions == null ? List.of() : List.copyOf(sessions);
    }
}

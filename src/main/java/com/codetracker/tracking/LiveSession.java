package com.codetracker.tracking;

import java.time.LocalDateTime;

public record LiveSession(String projectKey, String projectName, String language,
                          LocalDateTime startTime, LocalDateTime lastActivity) {
}

package com.codetracker.tracking;

import java.util.Objects;

public record SessionContext(String userId, String platform, String ideName) {

    public SessionContext {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(ideName, "ideName");
    }

    public static String currentPlatform() {
        return System.getProperty("os.name", "unknown") + " " + System.getProperty("os.version", "");
    }
}

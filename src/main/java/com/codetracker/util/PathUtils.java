package com.codetracker.util;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PathUtils {

    private static final String APP_DIR_NAME = "code-time-tracker";

    private static final Pattern PERCENT_ENV_PATTERN = Pattern.compile("%([A-Za-z0-9_]+)%");
    private static final Pattern BRACE_ENV_PATTERN = Pattern.compile("\\$\\{([^}]+)}");

    private PathUtils() {
    }

    /**
     * Data directory shared by every host that records into the same database.
     * <ul>
     *     <li>Windows: {@code %APPDATA%\code-time-tracker}</li>
     *     <li>elsewhere: {@code ~/.config/code-time-tracker}</li>
     * </ul>
     */
    public static Path defaultDataRoot() {
        String userHome = System.getProperty("user.home");
        if (SystemUtils.IS_OS_WINDOWS) {
            String appData = System.getenv("APPDATA");
            if (StringUtils.isBlank(appData)) {
                return Paths.get(userHome, "AppData", "Roaming", APP_DIR_NAME);
            }
            return Paths.get(appData, APP_DIR_NAME);
        }
        return Paths.get(userHome, ".config", APP_DIR_NAME);
    }

    public static Path resolve(String path) {
        Objects.requireNonNull(path, "path");
        return Paths.get(expand(path)).toAbsolutePath().normalize();
    }

    public static Path resolveOrDefault(String candidate, Path defaultPath) {
        Objects.requireNonNull(defaultPath, "defaultPath");
        if (StringUtils.isBlank(candidate)) {
            return defaultPath.toAbsolutePath().normalize();
        }
        return resolve(candidate);
    }

    /**
     * Expands {@code %VAR%}, {@code ${VAR}} and a leading {@code ~}. Unknown variables are left as written.
     */
    public static String expand(String path) {
        Objects.requireNonNull(path, "path");
        String trimmed = path.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        String resolved = replaceEnv(trimmed, PERCENT_ENV_PATTERN);
        resolved = replaceEnv(resolved, BRACE_ENV_PATTERN);
        if (resolved.startsWith("~")) {
            String home = System.getProperty("user.home");
            if (StringUtils.isNotBlank(home)) {
                resolved = home + resolved.substring(1);
            }
        }
        return resolved;
    }

    public static String lastSegment(String path) {
        if (StringUtils.isBlank(path)) {
            return "";
        }
        String trimmed = StringUtils.stripEnd(path.trim().replace('\\', '/'), "/");
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    private static String replaceEnv(String input, Pattern pattern) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder buffer = new StringBuilder();
        while (matcher.find()) {
            String value = lookupEnv(matcher.group(1));
            if (value == null) {
                value = matcher.group(0);
            }
            matcher.appendReplacement(buffer, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(buffer);
        return buffer.toString();
    }

    private static String lookupEnv(String key) {
        Map<String, String> env = System.getenv();
        String direct = env.get(key);
        if (direct != null) {
            return direct;
        }
        String upper = env.get(key.toUpperCase(Locale.ROOT));
        if (upper != null) {
            return upper;
        }
        return env.get(key.toLowerCase(Locale.ROOT));
    }
}

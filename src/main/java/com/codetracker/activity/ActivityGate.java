package com.codetracker.activity;

import com.codetracker.util.PathUtils;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Decides whether an edit counts as coding activity.
 * <p>
 * Only edits of existing, writable, regular files on the local file system count. Documents the
 * host marks read-only and anything below an excluded path are ignored. A location that cannot be
 * resolved is simply not activity.
 */
public class ActivityGate {

    private final List<Path> excludedPaths = new CopyOnWriteArrayList<>();

    public ActivityGate(List<String> excludedPaths) {
        updateExclusions(excludedPaths);
    }

    public boolean isCountableActivity(EditTarget target) {
        if (target == null || target.readOnly()) {
            return false;
        }
        Optional<Path> file = toLocalPath(target.location());
        if (file.isEmpty()) {
            return false;
        }
        Path path = file.get();
        if (!Files.isRegularFile(path) || !Files.isWritable(path)) {
            return false;
        }
        return excludedPaths.stream().noneMatch(path::startsWith);
    }

    public void updateExclusions(List<String> paths) {
        List<Path> resolved = paths == null
                ? List.of()
                : paths.stream()
                .filter(StringUtils::isNotBlank)
                .map(PathUtils::resolve)
                .distinct()
                .toList();
        excludedPaths.clear();
        excludedPaths.addAll(resolved);
    }

    /**
     * Local file behind a {@code file:} URI or a plain path. Other schemes have no local file.
     */
    static Optional<Path> toLocalPath(String location) {
        if (StringUtils.isBlank(location)) {
            return Optional.empty();
        }
        String trimmed = location.trim();
        try {
            String lower = trimmed.toLowerCase(Locale.ROOT);
            if (lower.startsWith("file:")) {
                return Optional.of(Path.of(URI.create(trimmed)).toAbsolutePath().normalize());
            }
            if (hasForeignScheme(trimmed)) {
                return Optional.empty();
            }
            return Optional.of(Path.of(trimmed).toAbsolutePath().normalize());
        } catch (IllegalArgumentException | FileSystemNotFoundException ex) {
            return Optional.empty();
        }
    }

    private static boolean hasForeignScheme(String location) {
        int colon = location.indexOf(':');
        if (colon <= 1) {
            // no scheme, or a Windows drive letter
            return false;
        }
        String scheme = location.substring(0, colon);
        return scheme.chars().allMatch(ch -> Character.isLetterOrDigit(ch) || ch == '+' || ch == '-' || ch == '.');
    }

    List<Path> excludedPaths() {
        return List.copyOf(excludedPaths);
    }
}

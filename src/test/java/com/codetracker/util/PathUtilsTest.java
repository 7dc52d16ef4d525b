package com.codetracker.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathUtilsTest {

    @Test
    void shouldExpandLeadingTildeToUserHome() {
        Path resolved = PathUtils.resolve("~/projects/demo");
        Path home = Path.of(System.getProperty("user.home")).toAbsolutePath().normalize();
        assertTrue(resolved.startsWith(home));
        assertTrue(resolved.endsWith(Path.of("projects", "demo")));
    }

    @Test
    void shouldLeaveUnknownVariablesAsWritten() {
        String expanded = PathUtils.expand("${CODE_TRACKER_SURELY_UNSET_VARIABLE}/data");
        assertEquals("${CODE_TRACKER_SURELY_UNSET_VARIABLE}/data", expanded);
    }

    @Test
    void shouldTakeLastSegmentOfUnixAndWindowsPaths() {
        assertEquals("demo", PathUtils.lastSegment("/home/dev/demo/"));
        assertEquals("demo", PathUtils.lastSegment("C:\\work\\demo"));
        assertEquals("demo", PathUtils.lastSegment("demo"));
        assertEquals("", PathUtils.lastSegment("  "));
    }

    @Test
    void shouldUseDefaultWhenCandidateIsBlank() {
        Path fallback = Path.of("fallback");
        assertEquals(fallback.toAbsolutePath().normalize(), PathUtils.resolveOrDefault(" ", fallback));
    }

    @Test
    void shouldPlaceDataRootInApplicationDirectory() {
        assertEquals("code-time-tracker", PathUtils.defaultDataRoot().getFileName().toString());
    }
}

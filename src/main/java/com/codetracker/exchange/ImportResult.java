package com.codetracker.exchange;

import java.util.Optional;

/**
 * Outcome of an import.
 *
 * @param totalInFile number of sessions listed in the file
 * @param imported    sessions written to storage
 * @param skipped     sessions whose UUID already existed, in storage or earlier in the file
 * @param failed      sessions that could not be written
 */
public record ImportResult(
        boolean success,
        int totalInFile,
        int imported,
        int skipped,
        int failed,
        Optional<String> errorMessage
) {

    static ImportResult completed(int totalInFile, int imported, int skipped) {
        return new ImportResult(true, totalInFile, imported, skipped, 0, Optional.empty());
    }

    static ImportResult failure(int totalInFile, int skipped, int failed, String message) {
        return new ImportResult(false, totalInFile, 0, skipped, failed, Optional.of(message));
    }
}

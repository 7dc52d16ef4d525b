package com.codetracker.activity;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What the host reports for one edit: the document location plus optional project and language
 * hints.
 *
 * @param location    {@code file:} URI or local path of the edited document
 * @param projectPath root of the owning project, or {@code null} to use the document's directory
 * @param projectName display name of the project, or {@code null} to derive it from the root
 * @param language    language reported by the host, or {@code null} to derive it from the extension
 * @param readOnly    whether the host flagged the document read-only
 */
public record EditTarget(String location, String projectPath, String projectName, String language, boolean readOnly) {

    public EditTarget {
        Objects.requireNonNull(location, "location");
    }

    public static EditTarget ofFile(Path file, Path projectRoot) {
        Objects.requireNonNull(file, "file");
        return new EditTarget(file.toString(),
                projectRoot == null ? null : projectRoot.toString(),
                null,
                null,
                false);
    }
}

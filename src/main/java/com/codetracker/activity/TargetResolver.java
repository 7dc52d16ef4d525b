package com.codetracker.activity;

import com.codetracker.util.PathUtils;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

public class TargetResolver {

    private final LanguageResolver languageResolver;

    public TargetResolver(LanguageResolver languageResolver) {
        this.languageResolver = Objects.requireNonNull(languageResolver, "languageResolver");
    }

    public Optional<ResolvedTarget> resolve(EditTarget target) {
        Objects.requireNonNull(target, "target");
        Optional<Path> file = ActivityGate.toLocalPath(target.location());
        if (file.isEmpty()) {
            return Optional.empty();
        }
        Path projectRoot = projectRoot(target, file.get());
        if (projectRoot == null) {
            return Optional.empty();
        }
        String projectKey = projectRoot.toString();
        String projectName = StringUtils.isNotBlank(target.projectName())
                ? target.projectName().trim()
                : PathUtils.lastSegment(projectKey);
        if (projectName.isEmpty()) {
            projectName = projectKey;
        }
        String language = languageResolver.resolve(target.language(), file.get());
        return Optional.of(new ResolvedTarget(projectKey, projectName, language, file.get()));
    }

    private static Path projectRoot(EditTarget target, Path file) {
        if (StringUtils.isNotBlank(target.projectPath())) {
            return PathUtils.resolve(target.projectPath());
        }
        return file.getParent();
    }
}

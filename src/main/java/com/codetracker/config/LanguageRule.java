package com.codetracker.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;

public record LanguageRule(String extension, String language) {

    @JsonCreator
    public LanguageRule(
            @JsonProperty("extension") String extension,
            @JsonProperty("language") String language
    ) {
        this.extension = normalizeExtension(Objects.requireNonNull(extension, "extension"));
        this.language = Objects.requireNonNull(language, "language").trim();
    }

    public boolean matches(String candidateExtension) {
        return candidateExtension != null && extension.equals(normalizeExtension(candidateExtension));
    }

    private static String normalizeExtension(String raw) {
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }
}

package com.codetracker.activity;

import com.codetracker.config.LanguageRule;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LanguageResolverTest {

    @Test
    void shouldPreferLanguageReportedByHost() {
        LanguageResolver resolver = new LanguageResolver(List.of());
        assertEquals("Kotlin Script", resolver.resolve(" Kotlin Script ", Path.of("build.gradle.kts")));
    }

    @Test
    void shouldApplyConfiguredRulesBeforeBuiltIns() {
        LanguageResolver resolver = new LanguageResolver(List.of(new LanguageRule(".h", "C++")));
        assertEquals("C++", resolver.resolve(null, Path.of("include/api.H")));
        assertEquals("C", resolver.resolve(null, Path.of("src/main.c")));
    }

    @Test
    void shouldFallBackToPlainText() {
        LanguageResolver resolver = new LanguageResolver(null);
        assertEquals(LanguageResolver.PLAIN_TEXT, resolver.resolve(null, Path.of("Makefile")));
        assertEquals(LanguageResolver.PLAIN_TEXT, resolver.resolve("", Path.of("notes.unknownext")));
        assertEquals(LanguageResolver.PLAIN_TEXT, resolver.resolve(null, Path.of(".gitignore")));
    }

    @Test
    void shouldReplaceRulesOnUpdate() {
        LanguageResolver resolver = new LanguageResolver(List.of(new LanguageRule("tpl", "Template")));
        resolver.updateRules(List.of(new LanguageRule("tpl", "Mustache")));
        assertEquals("Mustache", resolver.resolve(null, Path.of("page.tpl")));
    }

    @Test
    void shouldExtractLowerCaseExtension() {
        assertEquals("kt", LanguageResolver.extensionOf(Path.of("Main.KT")));
        assertEquals("", LanguageResolver.extensionOf(Path.of("trailing.")));
    }
}

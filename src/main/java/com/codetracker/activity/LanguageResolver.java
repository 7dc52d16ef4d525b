package com.codetracker.activity;

import com.codetracker.config.LanguageRule;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Language of an edited document. A language reported by the host wins, then configured extension
 * rules, then the built-in extension table.
 */
public class LanguageResolver {

    public static final String PLAIN_TEXT = "Plain Text";

    private static final Map<String, String> BUILT_IN = Map.ofEntries(
            Map.entry("java", "Java"),
            Map.entry("kt", "Kotlin"),
            Map.entry("kts", "Kotlin"),
            Map.entry("groovy", "Groovy"),
            Map.entry("scala", "Scala"),
            Map.entry("py", "Python"),
            Map.entry("js", "JavaScript"),
            Map.entry("mjs", "JavaScript"),
            Map.entry("jsx", "JavaScript"),
            Map.entry("ts", "TypeScript"),
            Map.entry("tsx", "TypeScript"),
            Map.entry("go", "Go"),
            Map.entry("rs", "Rust"),
            Map.entry("c", "C"),
            Map.entry("h", "C"),
            Map.entry("cpp", "C++"),
            Map.entry("cc", "C++"),
            Map.entry("hpp", "C++"),
            Map.entry("cs", "C#"),
            Map.entry("rb", "Ruby"),
            Map.entry("php", "PHP"),
            Map.entry("swift", "Swift"),
            Map.entry("dart", "Dart"),
            Map.entry("sql", "SQL"),
            Map.entry("sh", "Shell Script"),
            Map.entry("html", "HTML"),
            Map.entry("css", "CSS"),
            Map.entry("xml", "XML"),
            Map.entry("json", "JSON"),
            Map.entry("yml", "YAML"),
            Map.entry("yaml", "YAML"),
            Map.entry("md", "Markdown"),
            Map.entry("properties", "Properties"),
            Map.entry("txt", PLAIN_TEXT)
    );

    private final List<LanguageRule> rules;

    public LanguageResolver(List<LanguageRule> rules) {
        this.rules = new CopyOnWriteArrayList<>(rules == null ? List.of() : rules);
    }

    public String resolve(String hostLanguage, Path file) {
        if (StringUtils.isNotBlank(hostLanguage)) {
            return hostLanguage.trim();
        }
        String extension = extensionOf(file);
        if (extension.isEmpty()) {
            return PLAIN_TEXT;
        }
        for (LanguageRule rule : rules) {
            if (rule.matches(extension)) {
                return rule.language();
            }
        }
        return BUILT_IN.getOrDefault(extension, PLAIN_TEXT);
    }

    public void updateRules(List<LanguageRule> updated) {
        rules.clear();
        rules.addAll(updated == null ? List.of() : updated);
    }

    static String extensionOf(Path file) {
        if (file == null || file.getFileName() == null) {
            return "";
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}

package com.codeguard.cli.catalog;

import java.util.Locale;
import java.util.Map;

/**
 * Maps file names to the language identifiers analyzers declare support for.
 *
 * <p>Detection is purely name based: well-known file names first, then the extension.
 * Files that match neither are reported as {@value #UNKNOWN}; pattern-based analyzers such
 * as the dependency analyzer still pick them up by name.</p>
 */
public final class LanguageDetector {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> FILE_NAMES = Map.of(
        "dockerfile", "dockerfile",
        "makefile", "make",
        "gemfile", "ruby",
        "rakefile", "ruby",
        "jenkinsfile", "groovy"
    );

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
        Map.entry("py", "python"),
        Map.entry("pyi", "python"),
        Map.entry("js", "javascript"),
        Map.entry("jsx", "javascript"),
        Map.entry("mjs", "javascript"),
        Map.entry("cjs", "javascript"),
        Map.entry("ts", "typescript"),
        Map.entry("tsx", "typescript"),
        Map.entry("java", "java"),
        Map.entry("kt", "kotlin"),
        Map.entry("kts", "kotlin"),
        Map.entry("scala", "scala"),
        Map.entry("groovy", "groovy"),
        Map.entry("go", "go"),
        Map.entry("rb", "ruby"),
        Map.entry("php", "php"),
        Map.entry("cs", "csharp"),
        Map.entry("c", "c"),
        Map.entry("h", "c"),
        Map.entry("cpp", "cpp"),
        Map.entry("cc", "cpp"),
        Map.entry("cxx", "cpp"),
        Map.entry("hpp", "cpp"),
        Map.entry("rs", "rust"),
        Map.entry("swift", "swift"),
        Map.entry("sql", "sql"),
        Map.entry("sh", "shell"),
        Map.entry("bash", "shell"),
        Map.entry("yml", "yaml"),
        Map.entry("yaml", "yaml"),
        Map.entry("json", "json"),
        Map.entry("xml", "xml"),
        Map.entry("toml", "toml"),
        Map.entry("properties", "properties"),
        Map.entry("ini", "ini"),
        Map.entry("cfg", "ini"),
        Map.entry("md", "markdown"),
        Map.entry("txt", "text")
    );

    private LanguageDetector() {
        // Utility class
    }

    /**
     * Detects the language of a file from its name.
     *
     * @param fileName file name, with or without directories
     * @return language identifier, {@value #UNKNOWN} when not recognized
     */
    public static String detect(String fileName) {
        String name = fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);

        String byName = FILE_NAMES.get(name);
        if (byName != null) {
            return byName;
        }
        if (name.startsWith("dockerfile.") || name.endsWith(".dockerfile")) {
            return "dockerfile";
        }

        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return UNKNOWN;
        }
        return EXTENSIONS.getOrDefault(name.substring(dot + 1), UNKNOWN);
    }
}

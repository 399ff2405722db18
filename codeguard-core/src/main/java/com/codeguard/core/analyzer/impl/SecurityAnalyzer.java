package com.codeguard.core.analyzer.impl;

import com.codeguard.core.analyzer.AnalysisContext;
import com.codeguard.core.analyzer.base.AbstractRegexAnalyzer;
import com.codeguard.core.analyzer.base.RegexRule;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Severity;
import com.codeguard.core.model.SourceFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.MatchResult;

/**
 * Detects hard-coded secrets, common injection patterns and insecure container settings.
 *
 * <p><b>Checks:</b>
 * <ul>
 *   <li>Secrets (CWE-798): API keys, secret keys, passwords, tokens, private keys, AWS keys,
 *       GitHub tokens, JWTs, database URLs with credentials, SMTP passwords. Values that look
 *       like placeholders ({@code changeme}, {@code your_api_key}, ...) are ignored.</li>
 *   <li>SQL injection (CWE-89), XSS (CWE-79), command injection (CWE-78), path traversal
 *       (CWE-22), insecure deserialization (CWE-502), weak cryptography (CWE-327)</li>
 *   <li>Dockerfiles: running as root (CWE-250), {@code ADD} instead of {@code COPY}</li>
 * </ul>
 *
 * <p>Secret rules run on every supported file, configuration files included. Vulnerability
 * rules only run on source code.
 *
 * @since 1.0.0
 */
public class SecurityAnalyzer extends AbstractRegexAnalyzer {

    private static final String ANALYZER_ID = "security";
    private static final String CATEGORY = "security";

    private static final String CWE_URL = "https://cwe.mitre.org/data/definitions/%s.html";

    private static final Set<String> CODE_LANGUAGES = Set.of(
        "python", "javascript", "typescript", "java", "kotlin", "php", "ruby", "go",
        "csharp", "cpp", "c", "rust", "scala", "swift"
    );

    private static final Set<String> PLACEHOLDERS = Set.of(
        "your_api_key", "your-api-key", "your_secret", "changeme", "change_me", "replace_me",
        "example", "dummy", "placeholder", "xxx", "yyy", "zzz", "123456", "<", "${", "{{", "%("
    );

    private static final Set<String> EMPTY_VALUES = Set.of(
        "\"\"", "''", "[]", "{}", "null", "none", "undefined"
    );

    private static final List<RegexRule> SECRET_RULES = List.of(
        secret("SEC-API-KEY", "Potential API key detected",
            "(?i)(api[_-]?key|apikey)\\s*[=:]\\s*[\"']?([a-zA-Z0-9_\\-]{20,})[\"']?", Severity.HIGH),
        secret("SEC-SECRET-KEY", "Potential secret key detected",
            "(?i)(secret[_-]?key|secretkey)\\s*[=:]\\s*[\"']?([a-zA-Z0-9_\\-]{20,})[\"']?", Severity.HIGH),
        secret("SEC-PASSWORD", "Potential password detected",
            "(?i)(password|passwd|pwd)\\s*[=:]\\s*[\"']([^\"'\\s]{8,})[\"']", Severity.HIGH),
        secret("SEC-TOKEN", "Potential token detected",
            "(?i)(token|auth[_-]?token)\\s*[=:]\\s*[\"']?([a-zA-Z0-9_\\-.]{20,})[\"']?", Severity.HIGH),
        secret("SEC-PRIVATE-KEY", "Potential private key detected",
            "-----BEGIN\\s+(RSA\\s+|EC\\s+|OPENSSH\\s+)?PRIVATE\\s+KEY-----", Severity.CRITICAL),
        secret("SEC-AWS-ACCESS-KEY", "Potential AWS access key detected",
            "AKIA[0-9A-Z]{16}", Severity.HIGH),
        secret("SEC-AWS-SECRET-KEY", "Potential AWS secret key detected",
            "(?i)aws[_-]?secret[_-]?access[_-]?key.*[=:]\\s*[\"']?([a-zA-Z0-9/+=]{40})[\"']?", Severity.CRITICAL),
        secret("SEC-GITHUB-TOKEN", "Potential GitHub token detected",
            "ghp_[a-zA-Z0-9]{36}", Severity.HIGH),
        secret("SEC-JWT", "Potential JSON Web Token detected",
            "eyJ[a-zA-Z0-9_\\-]*\\.eyJ[a-zA-Z0-9_\\-]*\\.[a-zA-Z0-9_\\-]*", Severity.HIGH),
        secret("SEC-DATABASE-URL", "Potential database URL with credentials detected",
            "(?i)(database[_-]?url|db[_-]?url)\\s*[=:]\\s*[\"']?((postgres(ql)?|mysql|mongodb(\\+srv)?)://[^\"'\\s]+)[\"']?",
            Severity.HIGH),
        secret("SEC-SMTP-PASSWORD", "Potential SMTP password detected",
            "(?i)smtp[_-]?password\\s*[=:]\\s*[\"']?([^\"'\\s]{6,})[\"']?", Severity.HIGH)
    );

    private static final List<RegexRule> VULNERABILITY_RULES = List.of(
        vulnerability("SEC-SQL-INJECTION", "Potential SQL injection vulnerability",
            "(?i)(execute\\s*\\(\\s*[\"'].*[\"']\\s*\\+|cursor\\.execute\\s*\\(\\s*f?[\"'][^\"']*(%s|\\{)[^\"']*[\"']\\s*(%|\\.format|\\))"
                + "|query\\s*=\\s*[\"'][^\"']*[\"']\\s*\\+|SELECT.*WHERE.*=.*[\"']\\s*\\+)",
            Severity.HIGH, "89",
            "Use parameterized queries or prepared statements instead of string building"),
        vulnerability("SEC-XSS", "Potential cross-site scripting vulnerability",
            "(innerHTML\\s*=\\s*[^;]*\\+|document\\.write\\s*\\([^)]*\\+|dangerouslySetInnerHTML)",
            Severity.HIGH, "79",
            "Encode output or use textContent and framework escaping"),
        vulnerability("SEC-COMMAND-INJECTION", "Potential command injection vulnerability",
            "(os\\.system\\s*\\([^)]*\\+|subprocess\\.(call|run|Popen)\\s*\\([^)]*shell\\s*=\\s*True|"
                + "Runtime\\.getRuntime\\(\\)\\.exec\\s*\\([^)]*\\+|\\beval\\s*\\([^)]*\\+|shell_exec\\s*\\()",
            Severity.CRITICAL, "78",
            "Pass arguments as a list without a shell and validate all input"),
        vulnerability("SEC-PATH-TRAVERSAL", "Potential path traversal vulnerability",
            "(open\\s*\\([^)]*\\+[^)]*\\)|readFile(Sync)?\\s*\\([^)]*\\+|new\\s+File\\s*\\([^)]*\\+\\s*request)",
            Severity.HIGH, "22",
            "Normalize paths and verify they stay inside the allowed directory"),
        vulnerability("SEC-INSECURE-DESERIALIZATION", "Potential insecure deserialization",
            "(pickle\\.loads?\\s*\\(|yaml\\.load\\s*\\([^,)]*\\)|unserialize\\s*\\(|ObjectInputStream\\s*\\()",
            Severity.HIGH, "502",
            "Deserialize only trusted data; prefer yaml.safe_load or JSON"),
        vulnerability("SEC-WEAK-CRYPTO", "Weak cryptographic algorithm",
            "(hashlib\\.(md5|sha1)\\(|createHash\\s*\\(\\s*[\"'](md5|sha1)[\"']|"
                + "getInstance\\s*\\(\\s*\"(MD5|SHA-?1|DES|RC4)[\"/])",
            Severity.MEDIUM, "327",
            "Use SHA-256 or stronger hashes and AES-GCM for encryption")
    );

    @Override
    public String getId() {
        return ANALYZER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Security Analyzer";
    }

    @Override
    public String getDescription() {
        return "Hard-coded secrets, injection flaws, weak cryptography and insecure container settings";
    }

    @Override
    public String getCategory() {
        return CATEGORY;
    }

    @Override
    public Set<String> getSupportedLanguages() {
        return CODE_LANGUAGES;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of(
            ".env", ".env.*", "*.yml", "*.yaml", "*.json", "*.properties", "*.ini", "*.cfg",
            "*.conf", "Dockerfile", "Dockerfile.*", "*.dockerfile", "docker-compose*", "*.pem", "*.key"
        );
    }

    @Override
    protected List<RegexRule> getRules() {
        List<RegexRule> rules = new ArrayList<>(SECRET_RULES);
        rules.addAll(VULNERABILITY_RULES);
        return rules;
    }

    @Override
    protected boolean acceptMatch(RegexRule rule, MatchResult match, String line) {
        if (!SECRET_RULES.contains(rule)) {
            return true;
        }
        String value = match.groupCount() >= 2 && match.group(2) != null ? match.group(2) : match.group();
        return !isPlaceholderValue(value);
    }

    @Override
    protected List<Finding> additionalChecks(SourceFile file, List<String> lines, AnalysisContext context) {
        if (!isDockerfile(file)) {
            return List.of();
        }
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String stripped = lines.get(i).strip().toUpperCase(Locale.ROOT);
            if (stripped.startsWith("USER ROOT") || stripped.startsWith("USER 0")) {
                findings.add(newFinding(file, lines, i + 1)
                    .title("Container running as root user")
                    .description("The image switches to the root user, giving processes full privileges in the container")
                    .severity(Severity.HIGH)
                    .ruleId("SEC-DOCKER-ROOT")
                    .suggestion("Create an unprivileged user and switch to it with USER")
                    .reference(String.format(CWE_URL, "250"))
                    .confidence(0.9)
                    .build());
            }
            if (stripped.startsWith("ADD ") && !stripped.startsWith("ADD --")) {
                findings.add(newFinding(file, lines, i + 1)
                    .title("Use COPY instead of ADD for local files")
                    .description("ADD fetches remote URLs and unpacks archives implicitly")
                    .severity(Severity.LOW)
                    .ruleId("SEC-DOCKER-ADD")
                    .suggestion("Use COPY unless archive extraction is required")
                    .reference(String.format(CWE_URL, "693"))
                    .confidence(0.8)
                    .build());
            }
        }
        return findings;
    }

    /**
     * Checks whether a matched secret value is an obvious placeholder.
     *
     * @param value matched value
     * @return true if the value should not be reported
     */
    static boolean isPlaceholderValue(String value) {
        String stripped = value.strip();
        String lower = stripped.toLowerCase(Locale.ROOT);
        if (stripped.length() < 8 || EMPTY_VALUES.contains(lower)) {
            return true;
        }
        return PLACEHOLDERS.stream().anyMatch(lower::contains);
    }

    private static boolean isDockerfile(SourceFile file) {
        String name = file.fileName().toLowerCase(Locale.ROOT);
        return name.equals("dockerfile") || name.startsWith("dockerfile.") || name.endsWith(".dockerfile")
            || "dockerfile".equals(file.language());
    }

    private static RegexRule secret(String ruleId, String title, String regex, Severity severity) {
        return RegexRule.of(ruleId, title, regex, severity)
            .withDescription(title + ". Credentials committed to source control can be extracted by anyone with read access")
            .withSuggestion("Move the value to environment variables or a secret manager and rotate it")
            .withReferences(List.of(String.format(CWE_URL, "798")))
            .withConfidence(0.8);
    }

    private static RegexRule vulnerability(String ruleId, String title, String regex, Severity severity,
                                           String cwe, String suggestion) {
        return RegexRule.of(ruleId, title, regex, severity)
            .withDescription(title + " (CWE-" + cwe + ")")
            .withSuggestion(suggestion)
            .withReferences(List.of(String.format(CWE_URL, cwe)))
            .withLanguages(CODE_LANGUAGES)
            .withConfidence(0.7);
    }
}

package com.codeguard.core.analyzer.impl;

import com.codeguard.core.analyzer.AnalysisContext;
import com.codeguard.core.analyzer.AnalyzerExecutionException;
import com.codeguard.core.analyzer.base.AbstractJacksonAnalyzer;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Severity;
import com.codeguard.core.model.SourceFile;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reviews dependency manifests for supply-chain risks.
 *
 * <p><b>Supported manifests:</b>
 * <ul>
 *   <li>{@code requirements*.txt} and {@code pyproject.toml} (PEP 621 and Poetry)</li>
 *   <li>{@code package.json} (dependencies and devDependencies)</li>
 *   <li>{@code pom.xml} (dependencies and repositories)</li>
 *   <li>{@code go.mod}</li>
 *   <li>{@code Gemfile}</li>
 * </ul>
 *
 * <p><b>Checks:</b> unpinned or wildcard versions, open-ended ranges, pre-1.0 ranges,
 * SNAPSHOT and dynamic Maven versions, VCS or URL sources, plain-http sources, Go
 * pseudo-versions and local replacements, packages with known problems, and manifests
 * with an excessive number of dependencies.
 *
 * <p>Structured manifests that cannot be parsed raise {@link AnalyzerExecutionException}.
 *
 * @since 1.0.0
 */
public class DependencyAnalyzer extends AbstractJacksonAnalyzer {

    private static final String ANALYZER_ID = "dependency";
    private static final String CATEGORY = "dependency";

    static final int MAX_DEPENDENCIES = 50;

    /**
     * requirements.txt line: name[extras] operator version.
     * Captures: (1) package name, (2) operator, (3) version spec.
     */
    private static final Pattern REQUIREMENT_PATTERN = Pattern.compile(
        "^([a-zA-Z0-9_.\\-]+)(?:\\[[a-zA-Z0-9_,\\s-]+\\])?\\s*(?:([=<>~!]+)\\s*(.+))?$"
    );

    /**
     * go.mod require line. Captures: (1) module path, (2) version.
     */
    private static final Pattern GO_REQUIRE_PATTERN = Pattern.compile(
        "^\\s*(?:require\\s+)?([\\w.\\-]+(?:/[\\w.\\-]+)+)\\s+(v[\\w.+\\-]+)"
    );

    private static final Pattern GO_PSEUDO_VERSION = Pattern.compile("v\\d+\\.\\d+\\.\\d+-(?:0\\.)?\\d{14}-[0-9a-f]{12}");

    private static final Pattern GO_LOCAL_REPLACE = Pattern.compile("^\\s*(?:replace\\s+)?\\S+.*=>\\s*\\.{1,2}/");

    /**
     * Gemfile gem declaration. Captures: (1) gem name, (2) rest of the line.
     */
    private static final Pattern GEM_PATTERN = Pattern.compile("^\\s*gem\\s+['\"]([^'\"]+)['\"](.*)$");

    private static final Set<String> UNSPECIFIED_VERSIONS = Set.of("", "*", "latest", "x", "unspecified");

    private static final Map<String, Map<String, String>> PROBLEMATIC_PACKAGES = Map.of(
        "python", Map.of(
            "pycrypto", "Unmaintained with known vulnerabilities, use pycryptodome",
            "gpgme", "Known licensing issues"),
        "javascript", Map.of(
            "event-stream", "Compromised in a supply-chain attack",
            "natives", "Relies on Node.js internals and breaks between releases",
            "request", "Deprecated and no longer maintained"),
        "java", Map.of(
            "commons-collections:commons-collections", "Versions before 3.2.2 allow deserialization attacks",
            "log4j:log4j", "Log4j 1.x is end of life")
    );

    private record Declared(String name, String version, Integer line) {}

    @Override
    public String getId() {
        return ANALYZER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Dependency Analyzer";
    }

    @Override
    public String getDescription() {
        return "Unpinned, insecure or problematic dependencies in package manifests";
    }

    @Override
    public String getCategory() {
        return CATEGORY;
    }

    @Override
    public Set<String> getSupportedLanguages() {
        return Set.of();
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("requirements*.txt", "pyproject.toml", "package.json", "pom.xml", "go.mod", "Gemfile");
    }

    @Override
    protected List<Finding> analyzeTier1(SourceFile file, AnalysisContext context) throws AnalyzerExecutionException {
        String name = file.fileName();
        List<String> lines = lines(file);
        try {
            if (name.startsWith("requirements") && name.endsWith(".txt")) {
                return analyzeRequirements(file, lines);
            }
            return switch (name) {
                case "package.json" -> analyzePackageJson(file, lines);
                case "pom.xml" -> analyzePom(file, lines);
                case "pyproject.toml" -> analyzePyproject(file, lines);
                case "go.mod" -> analyzeGoMod(file, lines);
                case "Gemfile" -> analyzeGemfile(file, lines);
                default -> List.of();
            };
        } catch (IOException e) {
            throw new AnalyzerExecutionException(getId(), file.path(),
                "Could not parse dependency manifest: " + e.getMessage(), e);
        }
    }

    // ==================== Python ====================

    private List<Finding> analyzeRequirements(SourceFile file, List<String> lines) {
        List<Finding> findings = new ArrayList<>();
        int count = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = stripInlineComment(lines.get(i)).strip();
            if (line.isEmpty()) {
                continue;
            }
            int lineNumber = i + 1;
            if (line.startsWith("-i ") || line.startsWith("--index-url") || line.startsWith("--extra-index-url")) {
                if (line.contains("http://")) {
                    findings.add(insecureSource(file, lines, lineNumber, line));
                }
                continue;
            }
            if (line.startsWith("-e ") || line.contains("git+") || line.contains("://")) {
                count++;
                findings.add(vcsDependency(file, lines, lineNumber, line));
                if (line.contains("http://")) {
                    findings.add(insecureSource(file, lines, lineNumber, line));
                }
                continue;
            }
            if (line.startsWith("-")) {
                continue;
            }
            Matcher matcher = REQUIREMENT_PATTERN.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            count++;
            Declared dep = new Declared(matcher.group(1), matcher.group(2) == null ? "" : matcher.group(2) + matcher.group(3).strip(), lineNumber);
            findings.addAll(checkPythonSpec(file, lines, dep));
            findings.addAll(checkProblematic(file, lines, "python", dep));
        }
        findings.addAll(checkCount(file, count));
        return findings;
    }

    private List<Finding> analyzePyproject(SourceFile file, List<String> lines) throws IOException {
        JsonNode root = parseTomlContent(file.content());
        List<Finding> findings = new ArrayList<>();
        int count = 0;

        JsonNode projectDeps = root.path("project").path("dependencies");
        for (JsonNode dep : projectDeps) {
            Matcher matcher = REQUIREMENT_PATTERN.matcher(dep.asText().split(";")[0].strip());
            if (!matcher.matches()) {
                continue;
            }
            count++;
            String spec = matcher.group(2) == null ? "" : matcher.group(2) + matcher.group(3).strip();
            Declared declared = new Declared(matcher.group(1), spec, findLine(lines, "\"" + matcher.group(1)));
            findings.addAll(checkPythonSpec(file, lines, declared));
            findings.addAll(checkProblematic(file, lines, "python", declared));
        }

        JsonNode poetryDeps = root.path("tool").path("poetry").path("dependencies");
        Iterator<Map.Entry<String, JsonNode>> fields = poetryDeps.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getKey().equals("python")) {
                continue;
            }
            count++;
            JsonNode value = entry.getValue();
            Integer line = findLine(lines, entry.getKey() + " ");
            if (value.isObject() && (value.has("git") || value.has("url") || value.has("path"))) {
                findings.add(vcsDependency(file, lines, line, entry.getKey()));
                continue;
            }
            String version = value.isObject() ? extractAttribute(value, "version") : value.asText();
            Declared declared = new Declared(entry.getKey(), version == null ? "" : version, line);
            if (UNSPECIFIED_VERSIONS.contains(declared.version().strip())) {
                findings.add(unpinned(file, lines, declared));
            }
            findings.addAll(checkProblematic(file, lines, "python", declared));
        }
        findings.addAll(checkCount(file, count));
        return findings;
    }

    private List<Finding> checkPythonSpec(SourceFile file, List<String> lines, Declared dep) {
        String spec = dep.version();
        if (spec.isEmpty()) {
            return List.of(unpinned(file, lines, dep));
        }
        boolean lowerBoundOnly = (spec.startsWith(">=") || spec.startsWith(">")) && !spec.contains("<");
        if (lowerBoundOnly) {
            return List.of(findingAt(file, lines, dep.line())
                .title("Open-ended version range for '" + dep.name() + "'")
                .description("Package '" + dep.name() + "' only has a lower bound (" + spec
                    + "), so any future major release will be installed")
                .severity(Severity.LOW)
                .ruleId("DEP-OPEN-RANGE")
                .suggestion("Pin an exact version or add an upper bound and use a lock file")
                .confidence(0.8)
                .build());
        }
        return List.of();
    }

    // ==================== JavaScript ====================

    private List<Finding> analyzePackageJson(SourceFile file, List<String> lines) throws IOException {
        JsonNode root = parseJsonContent(file.content());
        if (root == null || !root.isObject()) {
            throw new IOException("package.json root is not an object");
        }
        List<Finding> findings = new ArrayList<>();
        int count = 0;
        for (String section : List.of("dependencies", "devDependencies", "optionalDependencies")) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.path(section).fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                count++;
                String version = entry.getValue().asText("").strip();
                Declared dep = new Declared(entry.getKey(), version, findLine(lines, "\"" + entry.getKey() + "\""));
                findings.addAll(checkNpmVersion(file, lines, dep));
                findings.addAll(checkProblematic(file, lines, "javascript", dep));
            }
        }
        findings.addAll(checkCount(file, count));
        return findings;
    }

    private List<Finding> checkNpmVersion(SourceFile file, List<String> lines, Declared dep) {
        String version = dep.version().toLowerCase(Locale.ROOT);
        if (UNSPECIFIED_VERSIONS.contains(version)) {
            return List.of(unpinned(file, lines, dep));
        }
        List<Finding> findings = new ArrayList<>();
        if (version.startsWith("git") || version.startsWith("http") || version.contains("github:")) {
            findings.add(vcsDependency(file, lines, dep.line(), dep.name() + "@" + dep.version()));
            if (version.startsWith("http://") || version.startsWith("git+http://")) {
                findings.add(insecureSource(file, lines, dep.line(), dep.version()));
            }
        } else if (version.startsWith(">=") || version.startsWith(">")) {
            findings.add(findingAt(file, lines, dep.line())
                .title("Open-ended version range for '" + dep.name() + "'")
                .description("Package '" + dep.name() + "' accepts any version " + dep.version())
                .severity(Severity.LOW)
                .ruleId("DEP-OPEN-RANGE")
                .suggestion("Use a caret or tilde range and commit package-lock.json")
                .confidence(0.8)
                .build());
        } else if (version.startsWith("^0.") || version.startsWith("~0.") || version.startsWith("0.")) {
            findings.add(findingAt(file, lines, dep.line())
                .title("Pre-1.0 dependency '" + dep.name() + "'")
                .description("Package '" + dep.name() + "' is on a 0.x version (" + dep.version()
                    + "), where minor releases may break compatibility")
                .severity(Severity.LOW)
                .ruleId("DEP-PRERELEASE")
                .suggestion("Check whether a stable release exists and pin the exact version")
                .confidence(0.6)
                .build());
        }
        return findings;
    }

    // ==================== Java ====================

    private List<Finding> analyzePom(SourceFile file, List<String> lines) throws IOException {
        JsonNode root = parseXmlContent(file.content());
        List<Finding> findings = new ArrayList<>();
        int count = 0;

        List<JsonNode> dependencies = new ArrayList<>(asList(root.path("dependencies").path("dependency")));
        dependencies.addAll(asList(root.path("dependencyManagement").path("dependencies").path("dependency")));
        for (JsonNode dependency : dependencies) {
            String groupId = extractAttribute(dependency, "groupId");
            String artifactId = extractAttribute(dependency, "artifactId");
            if (artifactId == null) {
                continue;
            }
            count++;
            String version = extractAttribute(dependency, "version");
            String coordinates = groupId + ":" + artifactId;
            Declared dep = new Declared(coordinates, version == null ? "" : version.strip(),
                findLine(lines, "<artifactId>" + artifactId + "</artifactId>"));
            findings.addAll(checkMavenVersion(file, lines, dep));
            findings.addAll(checkProblematic(file, lines, "java", dep));
        }

        List<JsonNode> repositories = new ArrayList<>(asList(root.path("repositories").path("repository")));
        repositories.addAll(asList(root.path("pluginRepositories").path("pluginRepository")));
        for (JsonNode repository : repositories) {
            String url = extractAttribute(repository, "url");
            if (url != null && url.strip().startsWith("http://")) {
                findings.add(insecureSource(file, lines, findLine(lines, url.strip()), url.strip()));
            }
        }
        findings.addAll(checkCount(file, count));
        return findings;
    }

    private List<Finding> checkMavenVersion(SourceFile file, List<String> lines, Declared dep) {
        String version = dep.version();
        if (version.isEmpty() || version.startsWith("${")) {
            // Managed by a parent, a BOM or a property
            return List.of();
        }
        if (version.endsWith("-SNAPSHOT")) {
            return List.of(findingAt(file, lines, dep.line())
                .title("SNAPSHOT dependency '" + dep.name() + "'")
                .description("Dependency '" + dep.name() + "' uses " + version
                    + ", which can change between builds")
                .severity(Severity.MEDIUM)
                .ruleId("DEP-SNAPSHOT")
                .suggestion("Depend on a released version")
                .confidence(0.95)
                .build());
        }
        if (version.equals("LATEST") || version.equals("RELEASE") || version.startsWith("[") || version.startsWith("(")) {
            return List.of(findingAt(file, lines, dep.line())
                .title("Dynamic version for '" + dep.name() + "'")
                .description("Dependency '" + dep.name() + "' resolves " + version
                    + " at build time, so builds are not reproducible")
                .severity(Severity.MEDIUM)
                .ruleId("DEP-DYNAMIC-VERSION")
                .suggestion("Pin a concrete version")
                .confidence(0.9)
                .build());
        }
        return List.of();
    }

    // ==================== Go and Ruby ====================

    private List<Finding> analyzeGoMod(SourceFile file, List<String> lines) {
        List<Finding> findings = new ArrayList<>();
        int count = 0;
        boolean inRequireBlock = false;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String stripped = line.strip();
            if (stripped.startsWith("require (")) {
                inRequireBlock = true;
                continue;
            }
            if (inRequireBlock && stripped.equals(")")) {
                inRequireBlock = false;
                continue;
            }
            if (GO_LOCAL_REPLACE.matcher(line).find() && (stripped.startsWith("replace") || !inRequireBlock)) {
                findings.add(newFinding(file, lines, i + 1)
                    .title("Local module replacement")
                    .description("A replace directive points to a local directory, so builds depend on the developer machine")
                    .severity(Severity.LOW)
                    .ruleId("DEP-LOCAL-REPLACE")
                    .suggestion("Remove local replace directives before release")
                    .confidence(0.9)
                    .build());
                continue;
            }
            if (!inRequireBlock && !stripped.startsWith("require ")) {
                continue;
            }
            Matcher matcher = GO_REQUIRE_PATTERN.matcher(line);
            if (!matcher.find()) {
                continue;
            }
            count++;
            Declared dep = new Declared(matcher.group(1), matcher.group(2), i + 1);
            if (GO_PSEUDO_VERSION.matcher(dep.version()).matches()) {
                findings.add(findingAt(file, lines, dep.line())
                    .title("Pseudo-version for module '" + dep.name() + "'")
                    .description("Module '" + dep.name() + "' is pinned to an untagged commit (" + dep.version() + ")")
                    .severity(Severity.LOW)
                    .ruleId("DEP-PSEUDO-VERSION")
                    .suggestion("Depend on a tagged release")
                    .confidence(0.8)
                    .build());
            }
        }
        findings.addAll(checkCount(file, count));
        return findings;
    }

    private List<Finding> analyzeGemfile(SourceFile file, List<String> lines) {
        List<Finding> findings = new ArrayList<>();
        int count = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.strip().startsWith("source ") && line.contains("http://")) {
                findings.add(insecureSource(file, lines, i + 1, line.strip()));
                continue;
            }
            Matcher matcher = GEM_PATTERN.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            count++;
            String rest = matcher.group(2);
            if (rest.contains("git:") || rest.contains("github:") || rest.contains(":git =>")) {
                findings.add(vcsDependency(file, lines, i + 1, matcher.group(1)));
            } else if (!rest.matches("\\s*,\\s*['\"].*")) {
                findings.add(unpinned(file, lines, new Declared(matcher.group(1), "", i + 1)));
            }
        }
        findings.addAll(checkCount(file, count));
        return findings;
    }

    // ==================== Shared Checks ====================

    private Finding unpinned(SourceFile file, List<String> lines, Declared dep) {
        return findingAt(file, lines, dep.line())
            .title("Unpinned dependency '" + dep.name() + "'")
            .description("Package '" + dep.name() + "' has unspecified version")
            .severity(Severity.MEDIUM)
            .ruleId("DEP-UNPINNED")
            .suggestion("Pin the dependency to a known good version")
            .confidence(0.9)
            .build();
    }

    private Finding vcsDependency(SourceFile file, List<String> lines, Integer line, String source) {
        return findingAt(file, lines, line)
            .title("Dependency installed from VCS or URL")
            .description("'" + source + "' bypasses the package registry and its integrity checks")
            .severity(Severity.MEDIUM)
            .ruleId("DEP-VCS")
            .suggestion("Publish the package to a registry or pin the source to an immutable commit")
            .confidence(0.85)
            .build();
    }

    private Finding insecureSource(SourceFile file, List<String> lines, Integer line, String source) {
        return findingAt(file, lines, line)
            .title("Dependency source over plain HTTP")
            .description("'" + source + "' is fetched without TLS and can be tampered with in transit")
            .severity(Severity.HIGH)
            .ruleId("DEP-INSECURE-SOURCE")
            .suggestion("Use an https:// source")
            .reference("https://cwe.mitre.org/data/definitions/829.html")
            .confidence(0.95)
            .build();
    }

    private List<Finding> checkProblematic(SourceFile file, List<String> lines, String ecosystem, Declared dep) {
        String reason = PROBLEMATIC_PACKAGES.getOrDefault(ecosystem, Map.of()).get(dep.name().toLowerCase(Locale.ROOT));
        if (reason == null) {
            return List.of();
        }
        return List.of(findingAt(file, lines, dep.line())
            .title("Package '" + dep.name() + "' has known issues")
            .description(reason)
            .severity(Severity.MEDIUM)
            .ruleId("DEP-KNOWN-ISSUE")
            .suggestion("Replace the package with a maintained alternative")
            .confidence(0.9)
            .build());
    }

    private List<Finding> checkCount(SourceFile file, int count) {
        if (count <= MAX_DEPENDENCIES) {
            return List.of();
        }
        return List.of(newFileFinding(file)
            .title("Large number of dependencies")
            .description("Manifest declares " + count + " dependencies, consider dependency cleanup")
            .severity(Severity.LOW)
            .ruleId("DEP-TOO-MANY")
            .suggestion("Remove unused dependencies")
            .confidence(0.7)
            .build());
    }

    private Finding.Builder findingAt(SourceFile file, List<String> lines, Integer line) {
        return line == null ? newFileFinding(file) : newFinding(file, lines, line);
    }

    private static String stripInlineComment(String line) {
        int hash = line.indexOf(" #");
        if (line.strip().startsWith("#")) {
            return "";
        }
        return hash >= 0 ? line.substring(0, hash) : line;
    }
}

package com.codeguard.core.config;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Named groups of analyzer ids.
 *
 * <p>Groups let a configuration enable several related analyzers at once:</p>
 * <pre>{@code
 * analysis:
 *   enabled_groups:
 *     - security
 * }</pre>
 *
 * @since 1.0.0
 */
public final class AnalyzerGroups {

    private AnalyzerGroups() {
        // Utility class
    }

    /**
     * Map of group names to analyzer IDs.
     */
    public static final Map<String, List<String>> GROUPS = Map.ofEntries(
        Map.entry("all", List.of(
            "security",
            "dependency",
            "code_quality",
            "performance",
            "best_practices"
        )),

        // Exploitability and supply chain
        Map.entry("security", List.of(
            "security",
            "dependency"
        )),

        // Maintainability
        Map.entry("quality", List.of(
            "code_quality",
            "best_practices",
            "performance"
        ))
    );

    /**
     * Get all analyzer IDs for the specified groups. Unknown group names are ignored.
     *
     * @param groupNames names of groups to expand
     * @return sorted set of analyzer IDs from all specified groups
     */
    public static Set<String> getAnalyzersForGroups(Collection<String> groupNames) {
        return groupNames.stream()
            .filter(GROUPS::containsKey)
            .flatMap(group -> GROUPS.get(group).stream())
            .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Get all available group names.
     *
     * @return set of group names
     */
    public static Set<String> getAvailableGroups() {
        return new TreeSet<>(GROUPS.keySet());
    }
}

package com.codeguard.core.analyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Catalog of available analyzers keyed by id.
 *
 * <p>{@link #discover()} loads analyzers via {@link ServiceLoader}. Tests and embedders
 * use {@link #of(Collection)} to supply their own instances. Iteration is always in id
 * order so that task construction is deterministic.
 *
 * @since 1.0.0
 */
public final class AnalyzerRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerRegistry.class);

    private final Map<String, Analyzer> analyzers;

    private AnalyzerRegistry(Map<String, Analyzer> analyzers) {
        this.analyzers = analyzers;
    }

    /**
     * Discovers all analyzers registered via SPI.
     *
     * @return registry of discovered analyzers
     */
    public static AnalyzerRegistry discover() {
        log.debug("Discovering analyzers via ServiceLoader");
        List<Analyzer> found = new ArrayList<>();
        ServiceLoader.load(Analyzer.class).forEach(found::add);
        AnalyzerRegistry registry = of(found);

        log.info("Discovered {} analyzers", registry.size());
        if (log.isDebugEnabled()) {
            registry.all().forEach(a -> log.debug("  - {} ({})", a.getId(), a.getDisplayName()));
        }
        return registry;
    }

    /**
     * Builds a registry from explicit instances. On duplicate ids the first one wins.
     *
     * @param candidates analyzers
     * @return registry
     */
    public static AnalyzerRegistry of(Collection<? extends Analyzer> candidates) {
        Map<String, Analyzer> byId = new TreeMap<>();
        for (Analyzer analyzer : candidates) {
            Analyzer existing = byId.putIfAbsent(analyzer.getId(), analyzer);
            if (existing != null && existing != analyzer) {
                log.warn("Duplicate analyzer id '{}': keeping {}, ignoring {}",
                    analyzer.getId(), existing.getClass().getName(), analyzer.getClass().getName());
            }
        }
        return new AnalyzerRegistry(byId);
    }

    public Optional<Analyzer> find(String id) {
        return Optional.ofNullable(analyzers.get(id));
    }

    public List<Analyzer> all() {
        return List.copyOf(analyzers.values());
    }

    public Set<String> ids() {
        return new TreeSet<>(analyzers.keySet());
    }

    public int size() {
        return analyzers.size();
    }

    public boolean isEmpty() {
        return analyzers.isEmpty();
    }

    /**
     * Splits requested ids into known analyzers and unknown ids.
     *
     * @param requestedIds enabled analyzer ids
     * @return resolution with analyzers in id order
     */
    public Resolution resolve(Collection<String> requestedIds) {
        List<Analyzer> resolved = new ArrayList<>();
        Set<String> unknown = new TreeSet<>();
        for (String id : new TreeSet<>(requestedIds)) {
            Analyzer analyzer = analyzers.get(id);
            if (analyzer != null) {
                resolved.add(analyzer);
            } else {
                unknown.add(id);
            }
        }
        return new Resolution(List.copyOf(resolved), Collections.unmodifiableSet(unknown));
    }

    /**
     * Result of {@link #resolve(Collection)}.
     *
     * @param analyzers known analyzers in id order
     * @param unknownIds requested ids with no analyzer
     */
    public record Resolution(List<Analyzer> analyzers, Set<String> unknownIds) {}
}

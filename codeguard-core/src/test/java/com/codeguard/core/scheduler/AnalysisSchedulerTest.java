package com.codeguard.core.scheduler;

import com.codeguard.core.analyzer.AnalyzerRegistry;
import com.codeguard.core.analyzer.ScriptedAnalyzer;
import com.codeguard.core.config.AnalysisConfig;
import com.codeguard.core.config.ConfigurationException;
import com.codeguard.core.model.Outcome;
import com.codeguard.core.model.OutcomeStatus;
import com.codeguard.core.model.Severity;
import com.codeguard.core.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AnalysisScheduler} and {@link ScheduledRun}.
 */
class AnalysisSchedulerTest {

    private final AnalysisScheduler scheduler = new AnalysisScheduler();

    @Test
    void run_withFailingAnalyzer_isolatesFailure() {
        // Given
        ScriptedAnalyzer healthy = ScriptedAnalyzer.returning("security", Severity.HIGH, "Hardcoded secret");
        ScriptedAnalyzer broken = ScriptedAnalyzer.failing("performance");
        AnalysisConfig config = config(Set.of("security", "performance"), 4, Duration.ofSeconds(5));

        // When
        SchedulerResult result = scheduler.run(files(3), List.of(healthy, broken), config, List.of());

        // Then
        assertThat(result.outcomes()).hasSize(6);
        assertThat(result.outcomes()).filteredOn(o -> o.analyzerId().equals("security"))
            .allMatch(Outcome::isCompleted)
            .allSatisfy(o -> assertThat(o.findings()).hasSize(1));
        assertThat(result.outcomes()).filteredOn(o -> o.analyzerId().equals("performance"))
            .extracting(Outcome::status)
            .containsOnly(OutcomeStatus.FAILED);
        assertThat(result.outcomes()).filteredOn(o -> o.status() == OutcomeStatus.FAILED)
            .allSatisfy(o -> assertThat(o.errorMessage()).contains("scripted failure"));
        assertThat(result.cancelled()).isFalse();
        assertThat(result.progress().completedTasks()).isEqualTo(3);
        assertThat(result.progress().failedTasks()).isEqualTo(3);
    }

    @Test
    void run_withUncheckedException_recordsFailure() {
        // Given
        ScriptedAnalyzer crashing = new ScriptedAnalyzer("security", (file, context) -> {
            throw new IllegalStateException("unexpected state");
        });

        // When
        SchedulerResult result = scheduler.run(files(1), List.of(crashing),
            config(Set.of("security"), 1, Duration.ofSeconds(5)), List.of());

        // Then
        assertThat(result.outcomes()).singleElement().satisfies(outcome -> {
            assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
            assertThat(outcome.errorMessage()).contains("IllegalStateException").contains("unexpected state");
        });
    }

    @Test
    void run_withSlowTask_timesOutOnlyThatTask() {
        // Given
        ScriptedAnalyzer analyzer = new ScriptedAnalyzer("performance", (file, context) -> {
            if (file.path().equals("src/file2.py")) {
                Thread.sleep(10_000);
            }
            return List.of();
        });
        AnalysisConfig config = config(Set.of("performance"), 5, Duration.ofSeconds(1));
        long started = System.nanoTime();

        // When
        SchedulerResult result = scheduler.run(files(5), List.of(analyzer), config, List.of());

        // Then
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        assertThat(result.outcomes()).hasSize(5);
        assertThat(result.outcomes()).filteredOn(Outcome::isCompleted).hasSize(4);
        assertThat(result.outcomes()).filteredOn(o -> o.status() == OutcomeStatus.TIMED_OUT)
            .singleElement()
            .satisfies(o -> {
                assertThat(o.filePath()).isEqualTo("src/file2.py");
                assertThat(o.errorMessage()).contains("1000 ms");
            });
    }

    @Test
    void run_withConcurrencyLimit_neverExceedsLimit() {
        // Given
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ScriptedAnalyzer analyzer = new ScriptedAnalyzer("code_quality", (file, context) -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(30);
            } finally {
                running.decrementAndGet();
            }
            return List.of();
        });
        AnalysisConfig config = config(Set.of("code_quality"), 3, Duration.ofSeconds(5));

        // When
        SchedulerResult result = scheduler.run(files(20), List.of(analyzer), config, List.of());

        // Then
        assertThat(result.outcomes()).hasSize(20).allMatch(Outcome::isCompleted);
        assertThat(peak.get()).isLessThanOrEqualTo(3);
        assertThat(result.progress().peakInFlightTasks()).isBetween(1, 3);
        assertThat(result.progress().peakRunningWorkers()).isBetween(1, 3);
        assertThat(result.progress().runningWorkers()).isZero();
    }

    @Test
    void run_withTimedOutCallIgnoringInterrupt_keepsItsSlotUntilTheCallReturns() {
        // Given: every call busy-spins past its deadline without checking for interruption
        AtomicInteger executing = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ScriptedAnalyzer analyzer = new ScriptedAnalyzer("performance", (file, context) -> {
            int now = executing.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                long spinUntil = System.nanoTime() + Duration.ofMillis(400).toNanos();
                while (System.nanoTime() < spinUntil) {
                    Thread.onSpinWait();
                }
            } finally {
                executing.decrementAndGet();
            }
            return List.of();
        });
        AnalysisConfig config = config(Set.of("performance"), 1, Duration.ofMillis(100));

        // When
        SchedulerResult result = scheduler.run(files(4), List.of(analyzer), config, List.of());

        // Then
        assertThat(result.outcomes()).hasSize(4)
            .extracting(Outcome::status)
            .containsOnly(OutcomeStatus.TIMED_OUT);
        assertThat(peak.get()).isEqualTo(1);
        assertThat(result.progress().peakRunningWorkers()).isEqualTo(1);
        assertThat(result.progress().peakInFlightTasks()).isEqualTo(1);
    }

    @Test
    void run_withSubsetEnabled_runsOnlyEnabledAnalyzers() {
        // Given
        ScriptedAnalyzer security = ScriptedAnalyzer.silent("security");
        ScriptedAnalyzer performance = ScriptedAnalyzer.silent("performance");
        AnalyzerRegistry registry = AnalyzerRegistry.of(List.of(security, performance));

        // When
        SchedulerResult result = scheduler.run(files(4), registry,
            config(Set.of("security", "no_such_analyzer"), 2, Duration.ofSeconds(5)), List.of());

        // Then
        assertThat(result.outcomes()).hasSize(4).extracting(Outcome::analyzerId).containsOnly("security");
        assertThat(security.invocations()).isEqualTo(4);
        assertThat(performance.invocations()).isZero();
    }

    @Test
    void run_withUnsupportedLanguage_createsNoTask() {
        // Given
        ScriptedAnalyzer pythonOnly = new ScriptedAnalyzer("best_practices", "best_practices", Set.of("python"),
            (file, context) -> List.of());
        List<SourceFile> catalog = List.of(
            new SourceFile("app.py", "print('hi')\n", "python"),
            new SourceFile("App.java", "class App {}\n", "java"));

        // When
        SchedulerResult result = scheduler.run(catalog, List.of(pythonOnly),
            config(Set.of("best_practices"), 2, Duration.ofSeconds(5)), List.of());

        // Then
        assertThat(result.outcomes()).extracting(Outcome::filePath).containsExactly("app.py");
    }

    @Test
    void run_withSkipPatterns_skipsMatchingFiles() {
        // Given
        ScriptedAnalyzer analyzer = ScriptedAnalyzer.silent("security");
        List<SourceFile> catalog = List.of(
            new SourceFile("src/app.js", "let a = 1;\n", "javascript"),
            new SourceFile("static/app.min.js", "let a=1;", "javascript"),
            new SourceFile("node_modules/lib/index.js", "module.exports = {};\n", "javascript"));

        // When
        SchedulerResult result = scheduler.run(catalog, List.of(analyzer),
            config(Set.of("security"), 2, Duration.ofSeconds(5)), List.of());

        // Then
        assertThat(result.outcomes()).extracting(Outcome::filePath).containsExactly("src/app.js");
    }

    @Test
    void run_withEmptyCatalog_throwsConfigurationException() {
        assertThatThrownBy(() -> scheduler.run(List.of(), List.of(ScriptedAnalyzer.silent("security")),
            config(Set.of("security"), 1, Duration.ofSeconds(1)), List.of()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("empty");
    }

    @Test
    void run_withNoEnabledAnalyzers_throwsConfigurationException() {
        assertThatThrownBy(() -> scheduler.run(files(1), List.of(ScriptedAnalyzer.silent("security")),
            config(Set.of(), 1, Duration.ofSeconds(1)), List.of()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("No analyzers enabled");
    }

    @Test
    void run_withOnlyUnknownAnalyzers_throwsConfigurationException() {
        assertThatThrownBy(() -> scheduler.run(files(1), List.of(ScriptedAnalyzer.silent("security")),
            config(Set.of("linting"), 1, Duration.ofSeconds(1)), List.of()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("linting");
    }

    @Test
    void run_withInvalidSkipPattern_throwsConfigurationException() {
        // Given
        ScriptedAnalyzer analyzer = ScriptedAnalyzer.silent("security");
        AnalysisConfig config = config(Set.of("security"), 1, Duration.ofSeconds(1)).toBuilder()
            .skipPatterns(List.of("["))
            .build();

        // When / Then
        assertThatThrownBy(() -> scheduler.run(files(1), List.of(analyzer), config, List.of()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Invalid skip pattern");
        assertThat(analyzer.invocations()).isZero();
    }

    @Test
    void cancel_duringRun_stopsDispatchAndDropsAbandonedTasks() throws Exception {
        // Given
        ScriptedAnalyzer analyzer = ScriptedAnalyzer.sleeping("performance", Duration.ofSeconds(30));
        ScheduledRun run = scheduler.start(files(6), List.of(analyzer),
            config(Set.of("performance"), 2, Duration.ofSeconds(60)), List.of());
        waitForInFlight(run, 2);
        long cancelledAt = System.nanoTime();

        // When
        run.cancel();
        SchedulerResult result = run.await();

        // Then
        assertThat(Duration.ofNanos(System.nanoTime() - cancelledAt)).isLessThan(Duration.ofSeconds(5));
        assertThat(run.isCancelled()).isTrue();
        assertThat(run.isDone()).isTrue();
        assertThat(result.cancelled()).isTrue();
        assertThat(result.outcomes()).isEmpty();
        assertThat(result.progress().dispatchedTasks()).isEqualTo(2);
        assertThat(result.progress().inFlightTasks()).isZero();
    }

    @Test
    void run_withSameSeed_givesEveryTaskTheSameRandomSequence() {
        // Given
        AnalysisConfig config = config(Set.of("security"), 4, Duration.ofSeconds(5)).toBuilder()
            .randomSeed(42L)
            .build();

        // When
        Map<String, Long> first = drawRandoms(config);
        Map<String, Long> second = drawRandoms(config);
        Map<String, Long> other = drawRandoms(config.toBuilder().randomSeed(7L).build());

        // Then
        assertThat(first).hasSize(8).isEqualTo(second);
        assertThat(other).isNotEqualTo(first);
    }

    @Test
    void run_withObserver_reportsEverySettledTask() {
        // Given
        List<ProgressSnapshot> snapshots = new CopyOnWriteArrayList<>();
        ScriptedAnalyzer analyzer = ScriptedAnalyzer.returning("security", Severity.LOW, "Debug flag");

        // When
        SchedulerResult result = scheduler.run(files(5), List.of(analyzer),
            config(Set.of("security"), 2, Duration.ofSeconds(5)), List.of(snapshots::add));

        // Then
        assertThat(snapshots).hasSize(5);
        assertThat(snapshots).extracting(ProgressSnapshot::settledTasks).containsExactlyInAnyOrder(1, 2, 3, 4, 5);
        assertThat(result.progress().progressPercent()).isEqualTo(100.0);
        assertThat(result.progress().findingsSoFar()).isEqualTo(5);
        assertThat(result.progress().perAnalyzerStats().get("security").filesProcessed()).isEqualTo(5);
    }

    private Map<String, Long> drawRandoms(AnalysisConfig config) {
        Map<String, Long> draws = new ConcurrentHashMap<>();
        ScriptedAnalyzer analyzer = new ScriptedAnalyzer("security", (file, context) -> {
            draws.put(file.path(), context.random().nextLong());
            return List.of();
        });
        scheduler.run(files(8), List.of(analyzer), config, List.of());
        return draws;
    }

    private static void waitForInFlight(ScheduledRun run, int expected) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (run.snapshot().inFlightTasks() < expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(run.snapshot().inFlightTasks()).isEqualTo(expected);
    }

    private static AnalysisConfig config(Set<String> analyzers, int maxConcurrent, Duration timeout) {
        return AnalysisConfig.builder()
            .enabledAnalyzers(analyzers)
            .maxConcurrentTasks(maxConcurrent)
            .perTaskTimeout(timeout)
            .build();
    }

    private static List<SourceFile> files(int count) {
        List<SourceFile> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            files.add(new SourceFile("src/file" + i + ".py", "value = " + i + "\n", "python"));
        }
        return files;
    }
}

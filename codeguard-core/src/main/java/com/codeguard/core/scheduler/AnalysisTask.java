package com.codeguard.core.scheduler;

import com.codeguard.core.analyzer.Analyzer;
import com.codeguard.core.model.SourceFile;

/**
 * One (file, analyzer) unit of work.
 *
 * @param index position in the deterministic task order
 * @param file file to analyze
 * @param analyzer analyzer to run
 */
record AnalysisTask(int index, SourceFile file, Analyzer analyzer) {

    String analyzerId() {
        return analyzer.getId();
    }

    String filePath() {
        return file.path();
    }
}

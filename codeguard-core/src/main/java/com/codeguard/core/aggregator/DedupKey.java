package com.codeguard.core.aggregator;

import com.codeguard.core.model.Finding;

import java.util.Locale;

/**
 * Identity of a finding for deduplication.
 *
 * <p>Two findings are duplicates when they share the lowercased title, the file, the
 * category and the ten-line bucket. Findings without a line share bucket {@value #NO_LINE_BUCKET}.
 *
 * @param title lowercased title
 * @param filePath file path
 * @param category category
 * @param lineBucket {@code floor(line / 10)}
 */
public record DedupKey(String title, String filePath, String category, int lineBucket) {

    static final int BUCKET_SIZE = 10;
    static final int NO_LINE_BUCKET = -1;

    public static DedupKey of(Finding finding) {
        Integer line = finding.line();
        return new DedupKey(
            finding.title().toLowerCase(Locale.ROOT),
            finding.filePath(),
            finding.category(),
            line == null ? NO_LINE_BUCKET : Math.floorDiv(line, BUCKET_SIZE));
    }
}

package com.codeguard.core.report;

import com.codeguard.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of the most problematic files list.
 *
 * @param filePath file path
 * @param issueCount number of issues in the file
 * @param highestSeverity most severe issue in the file
 */
public record FileRanking(
    @JsonProperty("file_path") String filePath,
    @JsonProperty("issue_count") int issueCount,
    @JsonProperty("highest_severity") Severity highestSeverity
) {}

package com.codeguard.core.analyzer.deep;

import com.codeguard.core.analyzer.DeepInspectionRequest;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Severity;
import com.codeguard.core.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DeepInspectionPromptBuilder}.
 */
class DeepInspectionPromptBuilderTest {

    @Test
    void userPrompt_withFindings_listsThemByIndex() {
        // Given
        DeepInspectionPromptBuilder builder = new DeepInspectionPromptBuilder(8000);
        Finding first = Finding.builder()
            .title("Hardcoded secret").description("API key in source")
            .severity(Severity.CRITICAL).category("security").filePath("app.py").line(2)
            .build();
        Finding second = Finding.builder()
            .title("Weak hash").severity(Severity.MEDIUM).category("security").filePath("app.py")
            .build();
        DeepInspectionRequest request = new DeepInspectionRequest(
            new SourceFile("app.py", "import os\nKEY = 'abc'\n", "python"),
            "security", "security", "secrets and injection", List.of(first, second));

        // When
        String prompt = builder.userPrompt(request);

        // Then
        assertThat(prompt)
            .contains("Review the file app.py (language: python)")
            .contains("Focus on: secrets and injection")
            .contains("1: import os")
            .contains("2: KEY = 'abc'")
            .contains("[0] critical line 2: Hardcoded secret - API key in source")
            .contains("[1] medium line -: Weak hash")
            .contains("\"false_positives\"");
    }

    @Test
    void userPrompt_withoutFindings_saysSo() {
        // Given
        DeepInspectionPromptBuilder builder = new DeepInspectionPromptBuilder(8000);
        DeepInspectionRequest request = new DeepInspectionRequest(
            new SourceFile("Main.java", "class Main {}\n", "java"), "code_quality", "code_quality", null, null);

        // When
        String prompt = builder.userPrompt(request);

        // Then
        assertThat(prompt)
            .contains("The static analyzer reported no findings.")
            .doesNotContain("Focus on:");
    }

    @Test
    void userPrompt_withLongFile_truncatesContent() {
        // Given
        DeepInspectionPromptBuilder builder = new DeepInspectionPromptBuilder(40);
        String content = "line\n".repeat(100);
        DeepInspectionRequest request = new DeepInspectionRequest(
            new SourceFile("big.txt", content, "text"), "performance", "performance", null, List.of());

        // When
        String prompt = builder.userPrompt(request);

        // Then
        assertThat(prompt).contains("... (truncated)").doesNotContain("100: line");
    }

    @Test
    void constructor_withNonPositiveLimit_throwsException() {
        assertThatThrownBy(() -> new DeepInspectionPromptBuilder(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.codeguard.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Finding}, {@link Severity} and {@link SourceFile}.
 */
class FindingTest {

    @Test
    void constructor_withConfidenceOutOfRange_clampsIt() {
        assertThat(base().confidence(1.7).build().confidence()).isEqualTo(1.0);
        assertThat(base().confidence(-0.2).build().confidence()).isEqualTo(0.0);
        assertThat(base().confidence(Double.NaN).build().confidence()).isEqualTo(0.0);
    }

    @Test
    void missingField_reportsFirstMissingRequiredField() {
        assertThat(base().build().isWellFormed()).isTrue();
        assertThat(base().title(" ").build().missingField()).isEqualTo("title");
        assertThat(base().severity(null).build().missingField()).isEqualTo("severity");
        assertThat(base().category(null).build().missingField()).isEqualTo("category");
        assertThat(base().filePath("").build().missingField()).isEqualTo("filePath");
    }

    @Test
    void withReferences_replacesReferencesImmutably() {
        Finding finding = base().reference("CWE-89").build();

        Finding updated = finding.withReferences(List.of("CWE-89", "OWASP-A03"));

        assertThat(finding.references()).containsExactly("CWE-89");
        assertThat(updated.references()).containsExactly("CWE-89", "OWASP-A03");
    }

    @Test
    void references_withNullElements_dropsThem() {
        List<String> references = Arrays.asList("CWE-798", null, "OWASP-A07");

        Finding built = base().references(references).build();
        Finding replaced = base().build().withReferences(references);

        assertThat(built.references()).containsExactly("CWE-798", "OWASP-A07");
        assertThat(replaced.references()).containsExactly("CWE-798", "OWASP-A07");
    }

    @Test
    void severity_ordersFromCriticalToInfo() {
        assertThat(Severity.CRITICAL.isMoreSevereThan(Severity.HIGH)).isTrue();
        assertThat(Severity.INFO.isMoreSevereThan(Severity.LOW)).isFalse();
        assertThat(Severity.max(Severity.LOW, Severity.HIGH)).isEqualTo(Severity.HIGH);
        assertThat(Severity.max(null, Severity.INFO)).isEqualTo(Severity.INFO);
        assertThat(Severity.MEDIUM.toJson()).isEqualTo("medium");
        assertThat(Severity.fromString(" High ")).isEqualTo(Severity.HIGH);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "blocker", "warn"})
    void severityFromString_withUnknownValue_returnsNull(String input) {
        assertThat(Severity.fromString(input)).isNull();
    }

    @Test
    void sourceFile_normalizesPathAndLanguage() {
        SourceFile file = new SourceFile("src\\main\\App.java", null, "Java");

        assertThat(file.path()).isEqualTo("src/main/App.java");
        assertThat(file.language()).isEqualTo("java");
        assertThat(file.content()).isEmpty();
        assertThat(file.lineCount()).isZero();
        assertThat(new SourceFile("a.py", "a = 1\nb = 2\n", null).lineCount()).isEqualTo(2);
    }

    private static Finding.Builder base() {
        return Finding.builder()
            .title("Weak hash")
            .severity(Severity.MEDIUM)
            .category("security")
            .filePath("app/crypto.py")
            .line(4);
    }
}

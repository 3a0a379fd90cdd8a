package com.eainde.compliance.verdict;

import com.eainde.compliance.model.Assessment;
import com.eainde.compliance.model.ComplianceStatus;
import com.eainde.compliance.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static com.eainde.compliance.model.ComplianceStatus.COMPLIANT;
import static com.eainde.compliance.model.ComplianceStatus.NON_COMPLIANT;
import static com.eainde.compliance.model.ComplianceStatus.PARTIAL;
import static com.eainde.compliance.model.ComplianceStatus.UNKNOWN;
import static org.assertj.core.api.Assertions.assertThat;

class VerdictAggregatorTest {

    static Stream<Arguments> verdictTable() {
        return Stream.of(
                Arguments.of(List.of(COMPLIANT, COMPLIANT), Verdict.GREEN),
                Arguments.of(List.of(COMPLIANT, PARTIAL), Verdict.YELLOW),
                Arguments.of(List.of(COMPLIANT, UNKNOWN), Verdict.YELLOW),
                Arguments.of(List.of(COMPLIANT, NON_COMPLIANT), Verdict.RED),
                Arguments.of(List.of(PARTIAL, UNKNOWN, NON_COMPLIANT), Verdict.RED),
                Arguments.of(List.of(UNKNOWN), Verdict.YELLOW));
    }

    @ParameterizedTest(name = "{0} → {1}")
    @MethodSource("verdictTable")
    @DisplayName("should map statuses to the documented verdict")
    void aggregate(List<ComplianceStatus> statuses, Verdict expected) {
        assertThat(VerdictAggregator.aggregate(statuses)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should be YELLOW when nothing was evaluated")
    void emptyIsYellow() {
        assertThat(VerdictAggregator.aggregate(List.of())).isEqualTo(Verdict.YELLOW);
    }

    @Test
    @DisplayName("should not depend on input order")
    void orderIndependent() {
        assertThat(VerdictAggregator.aggregate(List.of(NON_COMPLIANT, COMPLIANT)))
                .isEqualTo(VerdictAggregator.aggregate(List.of(COMPLIANT, NON_COMPLIANT)));
    }

    @Test
    @DisplayName("should aggregate assessments by their status")
    void aggregateAssessments() {
        List<Assessment> assessments = List.of(
                new Assessment("REQ-001", COMPLIANT, 0.9, "quote", "ok", List.of(1)),
                Assessment.unknown("REQ-002", "no evidence"));

        assertThat(VerdictAggregator.aggregateAssessments(assessments)).isEqualTo(Verdict.YELLOW);
    }
}

package com.eainde.compliance.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComplianceStatusTest {

    @Test
    @DisplayName("should order statuses by strength")
    void strength() {
        assertThat(ComplianceStatus.COMPLIANT.isUpgradeFrom(ComplianceStatus.PARTIAL)).isTrue();
        assertThat(ComplianceStatus.PARTIAL.isUpgradeFrom(ComplianceStatus.UNKNOWN)).isTrue();
        assertThat(ComplianceStatus.NON_COMPLIANT.isUpgradeFrom(ComplianceStatus.UNKNOWN)).isFalse();
        assertThat(ComplianceStatus.UNKNOWN.isUpgradeFrom(ComplianceStatus.NON_COMPLIANT)).isFalse();
    }

    @Test
    @DisplayName("should parse model output leniently")
    void parse() {
        assertThat(ComplianceStatus.parse(" non-compliant ")).isEqualTo(ComplianceStatus.NON_COMPLIANT);
        assertThat(ComplianceStatus.parse("Partial")).isEqualTo(ComplianceStatus.PARTIAL);
        assertThatThrownBy(() -> ComplianceStatus.parse("MAYBE")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ComplianceStatus.parse(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should parse lower-case statuses regardless of the default locale")
    void parseUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(ComplianceStatus.parse("compliant")).isEqualTo(ComplianceStatus.COMPLIANT);
            assertThat(ComplianceStatus.parse("partial")).isEqualTo(ComplianceStatus.PARTIAL);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("should clamp assessment confidence into [0, 1]")
    void assessmentClamp() {
        assertThat(new Assessment("R", ComplianceStatus.PARTIAL, 1.7, "q", "r", List.of()).confidence()).isEqualTo(1.0);
        assertThat(new Assessment("R", ComplianceStatus.PARTIAL, -0.2, "q", "r", List.of()).confidence()).isEqualTo(0.0);
        assertThat(new Assessment("R", null, Double.NaN, null, null, null).status()).isEqualTo(ComplianceStatus.UNKNOWN);
    }

    @Test
    @DisplayName("should only replace the assessment when the verifier changed something")
    void applyVerification() {
        Assessment assessment = new Assessment("R", ComplianceStatus.COMPLIANT, 0.9, "q", "r", List.of(2));

        VerifiedAssessment approved = VerifiedAssessment.approvedAsIs(assessment, "ok");
        VerifiedAssessment downgraded = new VerifiedAssessment(
                "R", ComplianceStatus.COMPLIANT, ComplianceStatus.PARTIAL, 0.9, 0.6, "weak", false);

        assertThat(approved.applyTo(assessment)).isSameAs(assessment);
        Assessment applied = downgraded.applyTo(assessment);
        assertThat(applied.status()).isEqualTo(ComplianceStatus.PARTIAL);
        assertThat(applied.confidence()).isEqualTo(0.6);
        assertThat(applied.evidenceQuote()).isEqualTo("q");
        assertThat(applied.pageNumbers()).containsExactly(2);
    }
}

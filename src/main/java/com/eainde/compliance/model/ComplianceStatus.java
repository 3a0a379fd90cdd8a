package com.eainde.compliance.model;

import java.util.Locale;

/**
 * Per-requirement compliance status.
 *
 * <p>{@link #strength()} orders statuses for the never-upgrade rule:
 * COMPLIANT &gt; PARTIAL &gt; NON_COMPLIANT = UNKNOWN. Moving between the two
 * weakest statuses is neither an upgrade nor a downgrade.</p>
 */
public enum ComplianceStatus {
    COMPLIANT(3),
    PARTIAL(2),
    NON_COMPLIANT(1),
    UNKNOWN(1);

    private final int strength;

    ComplianceStatus(int strength) {
        this.strength = strength;
    }

    public int strength() {
        return strength;
    }

    /**
     * @return true if {@code this} claims more compliance than {@code original}
     */
    public boolean isUpgradeFrom(ComplianceStatus original) {
        return strength > original.strength;
    }

    /**
     * Lenient parse for oracle output ("non-compliant", " partial ", ...).
     *
     * @throws IllegalArgumentException if the value names no status
     */
    public static ComplianceStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is missing");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return ComplianceStatus.valueOf(normalized);
    }
}

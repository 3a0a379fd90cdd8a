package com.eainde.compliance.model;

/**
 * Risk tier of a catalog requirement. Declaration order is the severity order.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}

package com.eainde.compliance.model;

/** Overall three-level compliance signal of an audit. */
public enum Verdict {
    RED,
    YELLOW,
    GREEN
}

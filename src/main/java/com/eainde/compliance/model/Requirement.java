package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A regulatory requirement from the catalog. Immutable once loaded.
 *
 * @param requirementId unique, stable identifier (e.g. "REQ-001")
 * @param title         short title, also the source of retrieval keywords
 * @param text          full obligation text
 * @param sectionRef    statutory section reference
 * @param riskLevel     risk tier
 */
public record Requirement(
        @JsonProperty("requirement_id")   String requirementId,
        @JsonProperty("title")            String title,
        @JsonProperty("requirement_text") String text,
        @JsonProperty("section_ref")      String sectionRef,
        @JsonProperty("risk_level")       RiskLevel riskLevel
) {

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "of", "to", "a", "an", "in", "on", "or", "by", "with");

    public Requirement {
        Objects.requireNonNull(requirementId, "requirementId");
        Objects.requireNonNull(title, "title");
        if (text == null) text = title;
        if (riskLevel == null) riskLevel = RiskLevel.MEDIUM;
    }

    /**
     * Lower-cased, distinct title words used by lexical retrieval.
     */
    @JsonIgnore
    public List<String> keywords() {
        return Arrays.stream(title.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(w -> w.length() > 1)
                .filter(w -> !STOP_WORDS.contains(w))
                .distinct()
                .toList();
    }

    /** Query text used for semantic retrieval. */
    @JsonIgnore
    public String retrievalQuery() {
        return title + ". " + text;
    }
}

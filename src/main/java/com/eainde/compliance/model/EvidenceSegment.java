package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One retrieved piece of evidence with its provenance and relevance score.
 *
 * @param text           segment text, prefixed with {@code [Context: ...]} when a section is known
 * @param pages          1-based source pages
 * @param sectionContext section label or null
 * @param score          relevance score assigned by the retriever
 * @param retrievalType  strategy that produced this segment
 */
public record EvidenceSegment(
        @JsonProperty("text")            String text,
        @JsonProperty("pages")           List<Integer> pages,
        @JsonProperty("section_context") String sectionContext,
        @JsonProperty("score")           double score,
        @JsonProperty("retrieval_type")  String retrievalType
) {

    public EvidenceSegment {
        pages = pages != null ? List.copyOf(pages) : List.of();
    }

    /**
     * Builds the evidence text the assessor sees: section context header + segment text.
     */
    public static EvidenceSegment of(DocumentSegment segment, double score, String retrievalType) {
        String enriched = segment.sectionContext() != null && !segment.sectionContext().isBlank()
                ? "[Context: " + segment.sectionContext() + "]\n" + segment.text()
                : segment.text();
        return new EvidenceSegment(enriched, segment.pages(), segment.sectionContext(), score, retrievalType);
    }
}

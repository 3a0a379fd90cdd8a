package com.eainde.compliance.retrieval;

import com.eainde.compliance.model.DocumentSegment;
import com.eainde.compliance.model.EvidenceBundle;
import com.eainde.compliance.model.EvidenceSegment;
import com.eainde.compliance.model.Requirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keyword retrieval used when no embedding model is available.
 *
 * <p>Score = number of distinct title keywords contained in the segment
 * (case-insensitive) + {@code min(length, 500) / 500}. Only segments with at least
 * one keyword hit are ranked; ties keep document order. When nothing matches, the
 * first K segments are returned with score 0 so the assessor still sees a sample
 * of the document.</p>
 */
public class LexicalEvidenceRetriever implements EvidenceRetriever {

    private static final Logger log = LoggerFactory.getLogger(LexicalEvidenceRetriever.class);

    static final String RETRIEVAL_TYPE = "lexical";
    static final String SAMPLE_RETRIEVAL_TYPE = "lexical_sample";
    private static final double LENGTH_NORMALIZER = 500.0;

    private final int topK;
    private final Map<String, List<DocumentSegment>> segmentsByAudit = new ConcurrentHashMap<>();

    public LexicalEvidenceRetriever(int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1");
        }
        this.topK = topK;
    }

    public LexicalEvidenceRetriever() {
        this(DEFAULT_TOP_K);
    }

    @Override
    public void index(String auditId, List<DocumentSegment> segments) {
        segmentsByAudit.put(auditId, List.copyOf(segments));
        log.debug("Indexed {} segments for audit {}", segments.size(), auditId);
    }

    @Override
    public EvidenceBundle retrieve(String auditId, Requirement requirement) {
        List<DocumentSegment> segments = segmentsByAudit.getOrDefault(auditId, List.of());
        if (segments.isEmpty()) {
            return EvidenceBundle.empty(requirement.requirementId());
        }

        List<String> keywords = requirement.keywords();
        List<Scored> hits = new ArrayList<>();
        for (DocumentSegment segment : segments) {
            String lower = segment.text().toLowerCase(Locale.ROOT);
            long keywordHits = keywords.stream().filter(lower::contains).count();
            if (keywordHits > 0) {
                double lengthBonus = Math.min(segment.text().length(), LENGTH_NORMALIZER) / LENGTH_NORMALIZER;
                hits.add(new Scored(segment, keywordHits + lengthBonus));
            }
        }

        List<EvidenceSegment> evidence;
        if (hits.isEmpty()) {
            evidence = segments.stream()
                    .limit(topK)
                    .map(s -> EvidenceSegment.of(s, 0.0, SAMPLE_RETRIEVAL_TYPE))
                    .toList();
            log.debug("{}: no keyword hits, returning {} sample segments",
                    requirement.requirementId(), evidence.size());
        } else {
            // List.sort is stable, so equal scores keep document order
            hits.sort(Comparator.comparingDouble(Scored::score).reversed());
            evidence = hits.stream()
                    .limit(topK)
                    .map(h -> EvidenceSegment.of(h.segment(), h.score(), RETRIEVAL_TYPE))
                    .toList();
        }
        return new EvidenceBundle(requirement.requirementId(), evidence);
    }

    @Override
    public void evict(String auditId) {
        segmentsByAudit.remove(auditId);
    }

    @Override
    public String strategy() {
        return RETRIEVAL_TYPE;
    }

    private record Scored(DocumentSegment segment, double score) {}
}

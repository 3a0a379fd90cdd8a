package com.eainde.compliance.retrieval;

import com.eainde.compliance.model.DocumentSegment;
import com.eainde.compliance.model.EvidenceBundle;
import com.eainde.compliance.model.EvidenceSegment;
import com.eainde.compliance.model.Requirement;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * Semantic retrieval with a lexical bonus.
 *
 * <h3>Scoring:</h3>
 * <pre>
 * vectorScore  = 1 / (1 + cosineDistance(query, segment))
 * lexicalBonus = 0.5 if the segment contains the requirement title (case-insensitive), else 0
 * score        = vectorScore + lexicalBonus
 * </pre>
 *
 * Every segment of the audit is scored; the top K are returned.
 * Segments are stored with {@code audit_id} metadata so that one store can hold many audits.
 */
@Slf4j
public class HybridEvidenceRetriever implements EvidenceRetriever {

    static final String RETRIEVAL_TYPE = "hybrid";
    static final String AUDIT_ID_KEY = "audit_id";
    static final String ORDINAL_KEY = "ordinal";
    private static final double TITLE_BONUS = 0.5;

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> embeddingStore;
    private final int topK;
    private final Map<String, Map<Integer, DocumentSegment>> segmentsByAudit = new ConcurrentHashMap<>();

    public HybridEvidenceRetriever(EmbeddingModel embeddingModel,
                                   EmbeddingStore<TextSegment> embeddingStore,
                                   int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1");
        }
        this.embeddingModel = embeddingModel;
        this.embeddingStore = embeddingStore;
        this.topK = topK;
    }

    @Override
    public void index(String auditId, List<DocumentSegment> segments) {
        evict(auditId);
        Map<Integer, DocumentSegment> byOrdinal = new LinkedHashMap<>();
        segments.forEach(s -> byOrdinal.put(s.ordinal(), s));
        if (segments.isEmpty()) {
            segmentsByAudit.put(auditId, byOrdinal);
            return;
        }

        List<TextSegment> textSegments = segments.stream()
                .map(s -> TextSegment.from(s.text(), new Metadata()
                        .put(AUDIT_ID_KEY, auditId)
                        .put(ORDINAL_KEY, s.ordinal())))
                .toList();
        List<Embedding> embeddings = embeddingModel.embedAll(textSegments).content();
        embeddingStore.addAll(embeddings, textSegments);
        segmentsByAudit.put(auditId, byOrdinal);
        log.info("Embedded {} segments for audit {}", segments.size(), auditId);
    }

    @Override
    public EvidenceBundle retrieve(String auditId, Requirement requirement) {
        Map<Integer, DocumentSegment> segments = segmentsByAudit.getOrDefault(auditId, Map.of());
        if (segments.isEmpty()) {
            return EvidenceBundle.empty(requirement.requirementId());
        }

        Embedding query = embeddingModel.embed(requirement.retrievalQuery()).content();
        List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(EmbeddingSearchRequest.builder()
                .queryEmbedding(query)
                .maxResults(segments.size())
                .minScore(0.0)
                .filter(auditFilter(auditId))
                .build()).matches();

        String title = requirement.title().toLowerCase(Locale.ROOT);
        List<Scored> scored = new ArrayList<>();
        for (EmbeddingMatch<TextSegment> match : matches) {
            DocumentSegment segment = segments.get(match.embedded().metadata().getInteger(ORDINAL_KEY));
            if (segment == null) {
                continue;
            }
            double vectorScore = 1.0 / (1.0 + cosineDistance(match.score()));
            double bonus = segment.text().toLowerCase(Locale.ROOT).contains(title) ? TITLE_BONUS : 0.0;
            scored.add(new Scored(segment, vectorScore + bonus));
        }

        scored.sort(Comparator.comparingDouble(Scored::score).reversed()
                .thenComparingInt(s -> s.segment().ordinal()));
        List<EvidenceSegment> evidence = scored.stream()
                .limit(topK)
                .map(s -> EvidenceSegment.of(s.segment(), s.score(), RETRIEVAL_TYPE))
                .toList();

        log.debug("{}: {} hybrid candidates, returning {}",
                requirement.requirementId(), scored.size(), evidence.size());
        return new EvidenceBundle(requirement.requirementId(), evidence);
    }

    @Override
    public void evict(String auditId) {
        if (segmentsByAudit.remove(auditId) != null) {
            embeddingStore.removeAll(auditFilter(auditId));
        }
    }

    @Override
    public String strategy() {
        return RETRIEVAL_TYPE;
    }

    /**
     * Stores report relevance as {@code (cosine + 1) / 2}; converts back to cosine distance.
     */
    static double cosineDistance(double relevanceScore) {
        double cosine = 2.0 * relevanceScore - 1.0;
        return Math.max(0.0, 1.0 - cosine);
    }

    private static Filter auditFilter(String auditId) {
        return metadataKey(AUDIT_ID_KEY).isEqualTo(auditId);
    }

    private record Scored(DocumentSegment segment, double score) {}
}

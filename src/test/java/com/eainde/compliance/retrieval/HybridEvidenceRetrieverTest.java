package com.eainde.compliance.retrieval;

import com.eainde.compliance.model.DocumentSegment;
import com.eainde.compliance.model.EvidenceBundle;
import com.eainde.compliance.model.EvidenceSegment;
import com.eainde.compliance.model.Requirement;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HybridEvidenceRetrieverTest {

    /** Deterministic bag-of-words embedding; one bias dimension keeps vectors non-zero. */
    static class BagOfWordsEmbeddingModel implements EmbeddingModel {

        private static final int DIMENSIONS = 64;

        @Override
        public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
            return Response.from(textSegments.stream().map(s -> embedText(s.text())).toList());
        }

        private static Embedding embedText(String text) {
            float[] vector = new float[DIMENSIONS];
            vector[0] = 0.1f;
            for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
                if (word.length() > 2) {
                    vector[1 + Math.floorMod(word.hashCode(), DIMENSIONS - 1)] += 1f;
                }
            }
            return Embedding.from(vector);
        }
    }

    private static final Requirement CONSENT = new Requirement("REQ-001", "Explicit consent",
            "Personal data processed only with the consent of the data principal.", null, null);

    private HybridEvidenceRetriever retriever;

    @BeforeEach
    void setUp() {
        retriever = new HybridEvidenceRetriever(new BagOfWordsEmbeddingModel(), new InMemoryEmbeddingStore<>(), 2);
    }

    @Test
    @DisplayName("should rank the semantically closest segment with the title bonus first")
    void ranksHybrid() {
        retriever.index("audit-1", List.of(
                new DocumentSegment(0, "We serve cookies to every visitor of the website.", List.of(1), null),
                new DocumentSegment(1, "Explicit consent of the data principal is obtained before personal data is processed.",
                        List.of(2), "Section 3 Consent"),
                new DocumentSegment(2, "Our office is located in Mumbai.", List.of(3), null)));

        EvidenceBundle bundle = retriever.retrieve("audit-1", CONSENT);

        assertThat(bundle.segments()).hasSize(2);
        EvidenceSegment best = bundle.segments().get(0);
        assertThat(best.pages()).containsExactly(2);
        assertThat(best.retrievalType()).isEqualTo("hybrid");
        assertThat(best.text()).startsWith("[Context: Section 3 Consent]");
        assertThat(best.score()).isGreaterThan(1.0);
    }

    @Test
    @DisplayName("should never return segments of another audit")
    void scopedByAudit() {
        retriever.index("audit-1", List.of(new DocumentSegment(0, "Explicit consent is required.", List.of(1), null)));
        retriever.index("audit-2", List.of(new DocumentSegment(0, "Cookies only.", List.of(1), null)));

        EvidenceBundle bundle = retriever.retrieve("audit-2", CONSENT);

        assertThat(bundle.segments()).extracting(EvidenceSegment::text).containsExactly("Cookies only.");
    }

    @Test
    @DisplayName("should return an empty bundle when the audit has no segments")
    void emptyAudit() {
        retriever.index("audit-1", List.of());

        assertThat(retriever.retrieve("audit-1", CONSENT).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should convert relevance back to cosine distance")
    void cosineDistance() {
        assertThat(HybridEvidenceRetriever.cosineDistance(1.0)).isCloseTo(0.0, within(1e-9));
        assertThat(HybridEvidenceRetriever.cosineDistance(0.5)).isCloseTo(1.0, within(1e-9));
        assertThat(HybridEvidenceRetriever.cosineDistance(0.0)).isCloseTo(2.0, within(1e-9));
    }
}

package com.eainde.compliance.document;

import com.eainde.compliance.error.DocumentExtractionException;
import com.eainde.compliance.model.DocumentSegment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlainTextDocumentExtractorTest {

    @Test
    @DisplayName("should track pages across form feeds")
    void pages() {
        PlainTextDocumentExtractor extractor = PlainTextDocumentExtractor.builder().maxSegmentChars(30).build();

        List<DocumentSegment> segments = extractor.extract(DocumentSource.ofText("p.txt",
                "First page paragraph.\fSecond page paragraph."));

        assertThat(segments).hasSize(2);
        assertThat(segments.get(0).pages()).containsExactly(1);
        assertThat(segments.get(1).pages()).containsExactly(2);
        assertThat(segments).extracting(DocumentSegment::ordinal).containsExactly(0, 1);
        assertThat(segments).extracting(DocumentSegment::sectionContext).containsOnlyNulls();
    }

    @Test
    @DisplayName("should group paragraphs up to the size limit and record every covered page")
    void grouping() {
        PlainTextDocumentExtractor extractor = PlainTextDocumentExtractor.builder().build();

        List<DocumentSegment> segments = extractor.extract(DocumentSource.ofText("p.txt",
                "Alpha paragraph.\n\nBeta paragraph.\fGamma paragraph."));

        assertThat(segments).hasSize(1);
        assertThat(segments.get(0).text()).isEqualTo("Alpha paragraph.\n\nBeta paragraph.\n\nGamma paragraph.");
        assertThat(segments.get(0).pages()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("should record the headers each segment falls under, at most the last two")
    void sectionContext() {
        PlainTextDocumentExtractor extractor = PlainTextDocumentExtractor.builder().maxSegmentChars(60).build();

        List<DocumentSegment> segments = extractor.extract(DocumentSource.ofText("p.txt", """
                Preamble without a header.

                Section 4 Consent

                We ask for consent before processing.

                4.1 Withdrawal

                You can withdraw consent at any time.
                """));

        assertThat(segments).extracting(DocumentSegment::sectionContext).containsExactly(
                "Section 4 Consent",
                "Section 4 Consent > 4.1 Withdrawal",
                "4.1 Withdrawal");
    }

    @Test
    @DisplayName("should split a paragraph longer than the limit at word boundaries")
    void oversizedParagraph() {
        PlainTextDocumentExtractor extractor = PlainTextDocumentExtractor.builder().maxSegmentChars(40).build();
        String paragraph = "We retain personal data for as long as needed to provide the service "
                + "and to meet our legal obligations under applicable law.";

        List<DocumentSegment> segments = extractor.extract(DocumentSource.ofText("p.txt", paragraph));

        assertThat(segments).hasSizeGreaterThan(1)
                .allSatisfy(s -> assertThat(s.text().length()).isLessThanOrEqualTo(40));
        assertThat(String.join(" ", segments.stream().map(DocumentSegment::text).toList())).isEqualTo(paragraph);
    }

    @Test
    @DisplayName("should hard-cut a run of text with no whitespace")
    void unbrokenRun() {
        assertThat(PlainTextDocumentExtractor.splitToLimit("x".repeat(25), 10))
                .containsExactly("x".repeat(10), "x".repeat(10), "x".repeat(5));
    }

    @Test
    @DisplayName("should recognise keyword and numbered headers only when short")
    void headers() {
        assertThat(PlainTextDocumentExtractor.isHeader("Article 12 Rights of the Data Principal")).isTrue();
        assertThat(PlainTextDocumentExtractor.isHeader("3.2 Retention")).isTrue();
        assertThat(PlainTextDocumentExtractor.isHeader("We keep data for 3 years.")).isFalse();
        assertThat(PlainTextDocumentExtractor.isHeader("Section 1 " + "x".repeat(120))).isFalse();
    }

    @Test
    @DisplayName("should reject blank and non-UTF-8 documents")
    void rejects() {
        PlainTextDocumentExtractor extractor = PlainTextDocumentExtractor.builder().build();

        assertThatThrownBy(() -> extractor.extract(DocumentSource.ofText("blank.txt", " \n\f\n ")))
                .isInstanceOf(DocumentExtractionException.class);
        assertThatThrownBy(() -> extractor.extract(new DocumentSource("bin.pdf", new byte[]{(byte) 0xC3, (byte) 0x28})))
                .isInstanceOf(DocumentExtractionException.class)
                .hasMessageContaining("not valid UTF-8");
    }
}

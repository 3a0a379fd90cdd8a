package com.eainde.compliance.document;

import com.eainde.compliance.error.DocumentExtractionException;
import com.eainde.compliance.model.DocumentSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Segments UTF-8 plain text into section-aware chunks.
 *
 * <h3>Algorithm:</h3>
 * <ol>
 *   <li>Split into pages on the page delimiter (form feed by default).</li>
 *   <li>Split each page into paragraphs on blank lines.</li>
 *   <li>Short paragraphs that look like headers ({@code Section 4 ...},
 *       {@code Article 2}, {@code 3.1 Consent}) update the running section context.</li>
 *   <li>A paragraph longer than {@code maxSegmentChars} is cut at the last whitespace
 *       before the limit, or exactly at the limit when there is none.</li>
 *   <li>Paragraphs are grouped into segments of at most {@code maxSegmentChars};
 *       a segment records every page it touches and the last two headers seen.</li>
 * </ol>
 *
 * <pre>
 * DocumentExtractor extractor = PlainTextDocumentExtractor.builder()
 *         .maxSegmentChars(1500)
 *         .build();
 * List&lt;DocumentSegment&gt; segments = extractor.extract(source);
 * </pre>
 */
public class PlainTextDocumentExtractor implements DocumentExtractor {

    private static final Logger log = LoggerFactory.getLogger(PlainTextDocumentExtractor.class);

    private static final Pattern DEFAULT_PAGE_DELIMITER = Pattern.compile("\\f");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern KEYWORD_HEADER =
            Pattern.compile("^(Section|Article|Clause)\\s+\\d+.*", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBERED_HEADER = Pattern.compile("^\\d+(\\.\\d+)*\\.?\\s+[A-Z].*");
    private static final int MAX_HEADER_LENGTH = 100;

    private final int maxSegmentChars;
    private final Pattern pageDelimiter;

    private PlainTextDocumentExtractor(Builder builder) {
        if (builder.maxSegmentChars < 1) {
            throw new IllegalArgumentException("maxSegmentChars must be >= 1");
        }
        this.maxSegmentChars = builder.maxSegmentChars;
        this.pageDelimiter = builder.pageDelimiter;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<DocumentSegment> extract(DocumentSource source) {
        String text = decode(source);
        if (text.isBlank()) {
            throw new DocumentExtractionException(
                    "Document " + source.filename() + " contains no extractable text");
        }

        String[] pages = pageDelimiter.split(text, -1);
        List<DocumentSegment> segments = new ArrayList<>();

        StringBuilder current = new StringBuilder();
        TreeSet<Integer> currentPages = new TreeSet<>();
        LinkedHashSet<String> currentSections = new LinkedHashSet<>();
        String section = null;

        for (int p = 0; p < pages.length; p++) {
            int pageNumber = p + 1;
            for (String raw : PARAGRAPH_BREAK.split(pages[p])) {
                String paragraph = raw.strip();
                if (paragraph.isEmpty()) continue;

                if (isHeader(paragraph)) {
                    section = paragraph;
                }

                for (String piece : splitToLimit(paragraph, maxSegmentChars)) {
                    if (current.length() > 0 && current.length() + 2 + piece.length() > maxSegmentChars) {
                        segments.add(toSegment(segments.size(), current, currentPages, currentSections));
                        current.setLength(0);
                        currentPages.clear();
                        currentSections.clear();
                    }

                    if (current.length() > 0) current.append("\n\n");
                    current.append(piece);
                    currentPages.add(pageNumber);
                    if (section != null) currentSections.add(section);
                }
            }
        }
        if (current.length() > 0) {
            segments.add(toSegment(segments.size(), current, currentPages, currentSections));
        }

        log.info("Extracted {} segments from {} pages of {}", segments.size(), pages.length, source.filename());
        return segments;
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    static boolean isHeader(String paragraph) {
        if (paragraph.length() >= MAX_HEADER_LENGTH || paragraph.contains("\n")) return false;
        return KEYWORD_HEADER.matcher(paragraph).matches() || NUMBERED_HEADER.matcher(paragraph).matches();
    }

    static List<String> splitToLimit(String paragraph, int limit) {
        List<String> pieces = new ArrayList<>();
        String rest = paragraph;
        while (rest.length() > limit) {
            int cut = limit;
            while (cut > 0 && !Character.isWhitespace(rest.charAt(cut))) cut--;
            if (cut == 0) cut = limit;
            pieces.add(rest.substring(0, cut).strip());
            rest = rest.substring(cut).strip();
        }
        if (!rest.isEmpty()) pieces.add(rest);
        return pieces;
    }

    private static DocumentSegment toSegment(int ordinal,
                                             StringBuilder text,
                                             TreeSet<Integer> pages,
                                             LinkedHashSet<String> sections) {
        List<String> all = new ArrayList<>(sections);
        String context = all.isEmpty()
                ? null
                : String.join(" > ", all.subList(Math.max(0, all.size() - 2), all.size()));
        return new DocumentSegment(ordinal, text.toString(), new ArrayList<>(pages), context);
    }

    private static String decode(DocumentSource source) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(source.content()))
                    .toString()
                    .replace("\r\n", "\n");
        } catch (CharacterCodingException e) {
            throw new DocumentExtractionException(
                    "Document " + source.filename() + " is not valid UTF-8 text", e);
        }
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static class Builder {
        private int maxSegmentChars = 1500;
        private Pattern pageDelimiter = DEFAULT_PAGE_DELIMITER;

        private Builder() {}

        public Builder maxSegmentChars(int maxSegmentChars) {
            this.maxSegmentChars = maxSegmentChars;
            return this;
        }

        public Builder pageDelimiter(String regex) {
            this.pageDelimiter = Pattern.compile(regex);
            return this;
        }

        public PlainTextDocumentExtractor build() {
            return new PlainTextDocumentExtractor(this);
        }
    }
}

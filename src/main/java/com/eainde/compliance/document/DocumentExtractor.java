package com.eainde.compliance.document;

import com.eainde.compliance.error.DocumentExtractionException;
import com.eainde.compliance.model.DocumentSegment;

import java.util.List;

/**
 * Turns a submitted document into ordered text segments with page and section metadata.
 */
public interface DocumentExtractor {

    /**
     * @return segments in scan order, never empty
     * @throws DocumentExtractionException if the document is unreadable or has no text
     */
    List<DocumentSegment> extract(DocumentSource source);
}

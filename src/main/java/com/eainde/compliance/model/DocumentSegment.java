package com.eainde.compliance.model;

import java.util.List;

/**
 * A text segment produced by document extraction, in document scan order.
 *
 * @param ordinal        zero-based scan position within the document
 * @param text           segment text
 * @param pages          1-based pages the segment covers, ascending
 * @param sectionContext enclosing section headers, or null if none were detected
 */
public record DocumentSegment(
        int ordinal,
        String text,
        List<Integer> pages,
        String sectionContext
) {

    public DocumentSegment {
        text = text != null ? text : "";
        pages = pages != null ? List.copyOf(pages) : List.of();
    }
}

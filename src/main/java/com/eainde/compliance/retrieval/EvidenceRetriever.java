package com.eainde.compliance.retrieval;

import com.eainde.compliance.model.DocumentSegment;
import com.eainde.compliance.model.EvidenceBundle;
import com.eainde.compliance.model.Requirement;

import java.util.List;

/**
 * Finds the document segments most relevant to a requirement.
 *
 * <p>Segments are indexed per audit; retrieval never crosses audit boundaries.
 * An empty bundle is a valid result.</p>
 */
public interface EvidenceRetriever {

    int DEFAULT_TOP_K = 4;

    /**
     * Indexes the segments of one audit, replacing anything indexed before under the same id.
     */
    void index(String auditId, List<DocumentSegment> segments);

    EvidenceBundle retrieve(String auditId, Requirement requirement);

    /** Drops everything indexed for the audit. */
    void evict(String auditId);

    /** Short strategy name, recorded in the execution metadata of each run. */
    String strategy();
}

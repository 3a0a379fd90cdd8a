package com.eainde.compliance.catalog;

import com.eainde.compliance.model.FrameworkMetadata;
import com.eainde.compliance.model.Requirement;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only source of the requirements an audit is evaluated against.
 */
public interface RequirementCatalog {

    FrameworkMetadata framework();

    /** Requirements in catalog order. */
    List<Requirement> requirements();

    default Set<String> requirementIds() {
        return requirements().stream()
                .map(Requirement::requirementId)
                .collect(Collectors.toUnmodifiableSet());
    }

    default Optional<Requirement> find(String requirementId) {
        return requirements().stream()
                .filter(r -> r.requirementId().equals(requirementId))
                .findFirst();
    }
}

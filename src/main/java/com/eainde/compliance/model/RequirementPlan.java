package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Requirements selected for evaluation, in evaluation order.
 *
 * @param requirementIds selected requirement ids
 * @param reasoning      planner's explanation, may be null
 * @param fallback       true when the plan is the whole catalog because planning failed
 */
public record RequirementPlan(
        @JsonProperty("requirement_ids") List<String> requirementIds,
        @JsonProperty("reasoning")       String reasoning,
        @JsonProperty("fallback")        boolean fallback
) {

    public RequirementPlan {
        requirementIds = requirementIds != null ? List.copyOf(requirementIds) : List.of();
    }

    /**
     * Plan covering the whole catalog, used when the planner cannot be trusted.
     */
    public static RequirementPlan entireCatalog(Collection<Requirement> catalog, String reasoning) {
        return new RequirementPlan(
                catalog.stream().map(Requirement::requirementId).toList(),
                reasoning,
                true);
    }

    public boolean isEmpty() {
        return requirementIds.isEmpty();
    }

    /**
     * Keeps only ids present in {@code catalogIds}, dropping duplicates and
     * preserving plan order. Applying it twice yields the same plan.
     */
    public RequirementPlan retainCatalogIds(Set<String> catalogIds) {
        LinkedHashSet<String> kept = new LinkedHashSet<>();
        for (String id : requirementIds) {
            if (id != null && catalogIds.contains(id)) {
                kept.add(id);
            }
        }
        return new RequirementPlan(List.copyOf(kept), reasoning, fallback);
    }

    /** Ids in this plan that the catalog does not contain. */
    public List<String> unknownIds(Set<String> catalogIds) {
        return requirementIds.stream()
                .filter(id -> id == null || !catalogIds.contains(id))
                .distinct()
                .toList();
    }
}

package com.eainde.compliance.catalog;

import com.eainde.compliance.model.FrameworkMetadata;
import com.eainde.compliance.model.Requirement;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class InMemoryRequirementCatalog implements RequirementCatalog {

    private final FrameworkMetadata framework;
    private final Map<String, Requirement> requirements = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if two requirements share an id
     */
    public InMemoryRequirementCatalog(FrameworkMetadata framework, List<Requirement> requirements) {
        this.framework = framework;
        for (Requirement requirement : requirements) {
            if (this.requirements.putIfAbsent(requirement.requirementId(), requirement) != null) {
                throw new IllegalArgumentException("Duplicate requirement id: " + requirement.requirementId());
            }
        }
    }

    @Override
    public FrameworkMetadata framework() {
        return framework;
    }

    @Override
    public List<Requirement> requirements() {
        return List.copyOf(requirements.values());
    }

    @Override
    public Set<String> requirementIds() {
        return Set.copyOf(requirements.keySet());
    }

    @Override
    public Optional<Requirement> find(String requirementId) {
        return Optional.ofNullable(requirements.get(requirementId));
    }
}

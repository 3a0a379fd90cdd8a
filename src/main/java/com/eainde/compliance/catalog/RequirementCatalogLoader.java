package com.eainde.compliance.catalog;

import com.eainde.compliance.error.CatalogUnavailableException;
import com.eainde.compliance.model.FrameworkMetadata;
import com.eainde.compliance.model.Requirement;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads a catalog from JSON of the form:
 *
 * <pre>
 * {
 *   "framework":    {"name": "...", "version": "...", "effective_date": "YYYY-MM-DD"},
 *   "requirements": [{"requirement_id": "...", "title": "...", "requirement_text": "...",
 *                     "section_ref": "...", "risk_level": "HIGH"}]
 * }
 * </pre>
 */
@Slf4j
public class RequirementCatalogLoader {

    private final ObjectMapper objectMapper;

    public RequirementCatalogLoader() {
        this.objectMapper = JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public RequirementCatalog load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return load(in, resource.getDescription());
        } catch (IOException e) {
            throw new CatalogUnavailableException("Cannot read catalog " + resource.getDescription(), e);
        }
    }

    /**
     * @throws CatalogUnavailableException if the JSON is malformed, has no framework or no requirements
     */
    public RequirementCatalog load(InputStream in, String sourceName) {
        CatalogDocument document;
        try {
            document = objectMapper.readValue(in, CatalogDocument.class);
        } catch (IOException | RuntimeException e) {
            throw new CatalogUnavailableException("Malformed catalog " + sourceName + ": " + e.getMessage(), e);
        }
        if (document == null || document.framework() == null) {
            throw new CatalogUnavailableException("Catalog " + sourceName + " has no framework section");
        }
        if (document.requirements() == null || document.requirements().isEmpty()) {
            throw new CatalogUnavailableException("Catalog " + sourceName + " has no requirements");
        }
        try {
            RequirementCatalog catalog = new InMemoryRequirementCatalog(document.framework(), document.requirements());
            log.info("Loaded {} requirements for {} {} from {}",
                    document.requirements().size(),
                    document.framework().name(),
                    document.framework().version(),
                    sourceName);
            return catalog;
        } catch (IllegalArgumentException e) {
            throw new CatalogUnavailableException("Invalid catalog " + sourceName + ": " + e.getMessage(), e);
        }
    }

    record CatalogDocument(
            @JsonProperty("framework")    FrameworkMetadata framework,
            @JsonProperty("requirements") List<Requirement> requirements
    ) {}
}

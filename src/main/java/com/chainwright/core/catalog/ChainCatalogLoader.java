package com.chainwright.core.catalog;

import com.chainwright.core.agent.AgentDescriptor;
import com.chainwright.core.model.StageId;
import com.chainwright.core.qualitygate.QualityGate;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Loads the chain catalog (stages, agent descriptors, quality gates, adaptive gate mapping)
 * from a JSON resource. The catalog content is opaque configuration; this class only maps
 * it onto typed records and lets {@link ChainCatalog} validate it.
 */
@Component
public class ChainCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(ChainCatalogLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public ChainCatalogLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads and validates the catalog at {@code location} (any Spring resource location,
     * e.g. {@code classpath:chain-catalog.json} or {@code file:/etc/chainwright/catalog.json}).
     *
     * @throws CatalogException if the resource is missing, malformed or inconsistent
     */
    public ChainCatalog load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogException("Chain catalog not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            var catalog = parse(in);
            log.info("Loaded chain catalog from {}: {} stages, {} agents, {} gates",
                    location, catalog.stages().size(), catalog.descriptors().size(), catalog.gates().size());
            return catalog;
        } catch (IOException e) {
            throw new CatalogException("Failed to read chain catalog at " + location + ": " + e.getMessage(), e);
        }
    }

    ChainCatalog parse(InputStream in) throws IOException {
        CatalogFile file;
        try {
            file = objectMapper.readValue(in, CatalogFile.class);
        } catch (IOException e) {
            throw new CatalogException("Malformed chain catalog: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CatalogException("Invalid chain catalog entry: " + e.getMessage(), e);
        }
        return new ChainCatalog(
                file.stages() != null ? file.stages() : List.of(),
                file.agents() != null ? file.agents() : List.of(),
                file.gates() != null ? file.gates() : List.of(),
                file.adaptiveGates() != null ? file.adaptiveGates() : Map.of());
    }

    /** Raw JSON shape of the catalog file. */
    record CatalogFile(
        List<StageDefinition> stages,
        List<AgentDescriptor> agents,
        List<QualityGate> gates,
        Map<StageId, List<String>> adaptiveGates
    ) {}
}

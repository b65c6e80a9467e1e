package com.listing.reconciliation.taxonomy;

import com.listing.reconciliation.rules.KeyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link TaxonomyLookup}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryTaxonomy implements TaxonomyLookup {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTaxonomy.class);

    private final ConcurrentMap<String, String> makes = new ConcurrentHashMap<>();
    // makeId -> normalized model name -> model id
    private final ConcurrentMap<String, ConcurrentMap<String, String>> models = new ConcurrentHashMap<>();
    private final Map<TaxonomyKind, ConcurrentMap<String, String>> attributes = new EnumMap<>(TaxonomyKind.class);

    public InMemoryTaxonomy() {
        attributes.put(TaxonomyKind.BODY_TYPE, new ConcurrentHashMap<>());
        attributes.put(TaxonomyKind.FUEL_TYPE, new ConcurrentHashMap<>());
        attributes.put(TaxonomyKind.TRANSMISSION, new ConcurrentHashMap<>());
    }

    public InMemoryTaxonomy addMake(String id, String name) {
        makes.put(KeyNormalizer.normalize(name), id);
        models.computeIfAbsent(id, k -> new ConcurrentHashMap<>());
        return this;
    }

    public InMemoryTaxonomy addModel(String makeId, String id, String name) {
        modelsOf(makeId).put(KeyNormalizer.normalize(name), id);
        return this;
    }

    public InMemoryTaxonomy addAttribute(TaxonomyKind kind, String id, String name) {
        attributeTable(kind).put(KeyNormalizer.normalize(name), id);
        return this;
    }

    @Override
    public Optional<String> resolveMake(String makeName) {
        return Optional.ofNullable(makes.get(KeyNormalizer.normalize(makeName)));
    }

    @Override
    public Optional<String> resolveModel(String makeId, String modelName) {
        if (makeId == null) {
            return Optional.empty();
        }
        Map<String, String> byName = models.get(makeId);
        return byName == null ? Optional.empty() : Optional.ofNullable(byName.get(KeyNormalizer.normalize(modelName)));
    }

    @Override
    public Optional<String> resolveAttribute(TaxonomyKind kind, String name) {
        return Optional.ofNullable(attributeTable(kind).get(KeyNormalizer.normalize(name)));
    }

    @Override
    public String registerModel(String makeId, String modelName) {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank");
        }
        String id = modelsOf(makeId).computeIfAbsent(KeyNormalizer.normalize(modelName),
                k -> UUID.randomUUID().toString());
        log.info("taxonomy.model.registered makeId={} model='{}' modelId={}", makeId, modelName.trim(), id);
        return id;
    }

    private ConcurrentMap<String, String> modelsOf(String makeId) {
        ConcurrentMap<String, String> byName = makeId != null ? models.get(makeId) : null;
        if (byName == null) {
            throw new IllegalArgumentException("Unknown make: " + makeId);
        }
        return byName;
    }

    private ConcurrentMap<String, String> attributeTable(TaxonomyKind kind) {
        ConcurrentMap<String, String> table = attributes.get(kind);
        if (table == null) {
            throw new IllegalArgumentException(kind + " is not an attribute taxonomy");
        }
        return table;
    }
}

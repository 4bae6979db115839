package com.eainde.verify.registry;

import com.eainde.verify.error.ConfigurationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the persisted domain records at startup and registers them.
 * <p>
 * Records come from {@code verification.domains} and, if configured, from a JSON array in
 * {@code verification.registry-file}. Any malformed record aborts startup with a
 * {@link ConfigurationException}, before a single run can begin.
 * </p>
 */
@Log4j2
public class DomainRegistryInitializer {

    private final DomainRegistry registry;
    private final ObjectMapper objectMapper;

    public DomainRegistryInitializer(DomainRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the number of domains registered
     */
    public int initialize(List<DomainRecord> configured, Path registryFile) {
        List<DomainRecord> records = new ArrayList<>(configured == null ? List.of() : configured);
        if (registryFile != null) {
            records.addAll(readRegistryFile(registryFile));
        }

        Set<String> seen = new HashSet<>();
        for (DomainRecord record : records) {
            Domain domain = toDomain(record);
            if (!seen.add(domain.id())) {
                throw new ConfigurationException("Duplicate domain id in configuration: " + domain.id());
            }
            registry.register(domain);
        }
        log.info("Domain registry initialized with {} domain(s)", records.size());
        return records.size();
    }

    Domain toDomain(DomainRecord record) {
        if (record == null) {
            throw new ConfigurationException("Null domain record");
        }
        if (record.getDomainId() == null || record.getDomainId().isBlank()) {
            throw new ConfigurationException("Domain record without domainId: " + record);
        }
        if (record.getAdapterType() == null || record.getAdapterType().isBlank()) {
            throw new ConfigurationException("Domain record without adapterType: " + record);
        }
        JsonNode config = record.getConfig() == null ? null : objectMapper.valueToTree(listify(record.getConfig()));
        if (config != null && !config.isObject()) {
            throw new ConfigurationException("Config of domain '%s' must be an object".formatted(record.getDomainId()));
        }
        return new Domain(
                record.getDomainId().trim(),
                new VerifierBinding(record.getAdapterType().trim(), config),
                record.getExtractionTemplate(),
                record.isActive());
    }

    /**
     * Spring binds YAML lists nested in a {@code Map<String, Object>} as maps keyed "0", "1", ...;
     * turn those back into lists so adapters see the JSON shape they were configured with.
     */
    static Object listify(Object value) {
        if (value instanceof Map<?, ?> map) {
            boolean indexed = !map.isEmpty();
            for (int i = 0; indexed && i < map.size(); i++) {
                indexed = map.containsKey(String.valueOf(i));
            }
            if (indexed) {
                List<Object> list = new ArrayList<>(map.size());
                for (int i = 0; i < map.size(); i++) {
                    list.add(listify(map.get(String.valueOf(i))));
                }
                return list;
            }
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, listify(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(DomainRegistryInitializer::listify).toList();
        }
        return value;
    }

    private List<DomainRecord> readRegistryFile(Path registryFile) {
        if (!Files.isRegularFile(registryFile)) {
            throw new ConfigurationException("Registry file not found: " + registryFile);
        }
        try {
            List<DomainRecord> records = objectMapper.readValue(registryFile.toFile(), new TypeReference<>() {
            });
            log.info("Read {} domain record(s) from {}", records.size(), registryFile);
            return records;
        } catch (IOException e) {
            throw new ConfigurationException("Malformed registry file: " + registryFile, e);
        }
    }
}

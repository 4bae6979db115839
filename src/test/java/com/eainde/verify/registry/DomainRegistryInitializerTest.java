package com.eainde.verify.registry;

import com.eainde.verify.error.ConfigurationException;
import com.eainde.verify.verifier.PatternRuleVerifierFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainRegistryInitializerTest {

    private DomainRegistry registry;
    private DomainRegistryInitializer initializer;

    @BeforeEach
    void setUp() {
        registry = new DomainRegistry(List.of(new PatternRuleVerifierFactory()));
        initializer = new DomainRegistryInitializer(registry, new ObjectMapper());
    }

    private static DomainRecord record(String id) {
        Map<String, Object> rule = new LinkedHashMap<>();
        rule.put("id", "tls");
        rule.put("requires", "TLS");
        return new DomainRecord(id, PatternRuleVerifierFactory.TYPE, Map.of("rules", List.of(rule)));
    }

    @Test
    @DisplayName("registers configured records and the registry file")
    void registersAll() throws Exception {
        Path file = Path.of(getClass().getResource("/registry/domains.json").toURI());

        int count = initializer.initialize(List.of(record("security")), file);

        assertThat(count).isEqualTo(3);
        assertThat(registry.list()).extracting(Domain::id).containsExactly("security", "privacy", "archive");
        assertThat(registry.isActive("archive")).isFalse();
        assertThat(registry.domain("privacy").extractionTemplateRef()).isEqualTo("bullet-items");
    }

    @Test
    @DisplayName("a record without adapter type aborts initialization")
    void missingAdapter() {
        DomainRecord bad = new DomainRecord("security", null, Map.of());

        assertThatThrownBy(() -> initializer.initialize(List.of(bad), null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("adapterType");
    }

    @Test
    @DisplayName("duplicate ids in configuration are rejected")
    void duplicate() {
        assertThatThrownBy(() -> initializer.initialize(List.of(record("security"), record("security")), null))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("a malformed registry file is a configuration error")
    void malformedFile(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("domains.json"), "{ not json");

        assertThatThrownBy(() -> initializer.initialize(List.of(), file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("a missing registry file is a configuration error")
    void missingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> initializer.initialize(List.of(), dir.resolve("absent.json")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("index-keyed maps from property binding are turned back into lists")
    void listify() {
        Map<String, Object> rule = Map.of("id", "tls", "requires", "TLS");
        Map<String, Object> bound = Map.of("rules", Map.of("0", rule));

        initializer.initialize(List.of(new DomainRecord("security", PatternRuleVerifierFactory.TYPE, bound)), null);

        assertThat(registry.lookup("security").config().get("rules").isArray()).isTrue();
    }
}

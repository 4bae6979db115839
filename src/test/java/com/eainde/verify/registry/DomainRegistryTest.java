package com.eainde.verify.registry;

import com.eainde.verify.error.ConfigurationException;
import com.eainde.verify.error.DomainNotFoundException;
import com.eainde.verify.model.Verdict;
import com.eainde.verify.support.ScriptedVerifier;
import com.eainde.verify.support.ScriptedVerifierFactory;
import com.eainde.verify.verifier.DomainVerifier;
import com.eainde.verify.verifier.VerifierAdapterFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainRegistryTest {

    private ScriptedVerifier docsVerifier;
    private DomainRegistry registry;

    @BeforeEach
    void setUp() {
        docsVerifier = ScriptedVerifier.always("docs", Verdict.VERIFIED);
        ScriptedVerifierFactory factory = new ScriptedVerifierFactory().with("docs", docsVerifier);
        registry = new DomainRegistry(List.of(factory));
    }

    @Nested
    @DisplayName("register()")
    class Register {

        @Test
        @DisplayName("builds the verifier through the matching factory")
        void buildsVerifier() {
            registry.register("docs", VerifierBinding.of(ScriptedVerifierFactory.TYPE), "bullet-items");

            assertThat(registry.resolveVerifier("docs")).isSameAs(docsVerifier);
            assertThat(registry.domain("docs").extractionTemplateRef()).isEqualTo("bullet-items");
            assertThat(registry.lookup("docs").adapterType()).isEqualTo(ScriptedVerifierFactory.TYPE);
        }

        @Test
        @DisplayName("a missing template falls back to declarative-sentences")
        void defaultTemplate() {
            registry.register("docs", VerifierBinding.of(ScriptedVerifierFactory.TYPE), null);

            assertThat(registry.domain("docs").extractionTemplateRef())
                    .isEqualTo(Domain.DEFAULT_EXTRACTION_TEMPLATE);
        }

        @Test
        @DisplayName("rejects an id that is already active")
        void duplicate() {
            registry.register("docs", VerifierBinding.of(ScriptedVerifierFactory.TYPE), null);

            assertThatThrownBy(() -> registry.register("docs", VerifierBinding.of(ScriptedVerifierFactory.TYPE), null))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("already registered");
        }

        @Test
        @DisplayName("re-registering a deactivated id reactivates it")
        void reactivate() {
            registry.register("docs", VerifierBinding.of(ScriptedVerifierFactory.TYPE), null);
            registry.deactivate("docs");

            registry.register("docs", VerifierBinding.of(ScriptedVerifierFactory.TYPE), "bullet-items");

            assertThat(registry.isActive("docs")).isTrue();
            assertThat(registry.list()).hasSize(1);
        }

        @Test
        @DisplayName("an unknown adapter type is a configuration error")
        void unknownAdapter() {
            assertThatThrownBy(() -> registry.register("docs", VerifierBinding.of("proof-checker"), null))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("proof-checker");
            assertThat(registry.list()).isEmpty();
        }

        @Test
        @DisplayName("a factory rejecting its config is a configuration error")
        void factoryFailure() {
            VerifierAdapterFactory broken = new VerifierAdapterFactory() {
                @Override
                public String adapterType() {
                    return "broken";
                }

                @Override
                public DomainVerifier create(String domainId, JsonNode config) {
                    throw new IllegalArgumentException("bad config");
                }
            };
            DomainRegistry withBroken = new DomainRegistry(List.of(broken));

            assertThatThrownBy(() -> withBroken.register("x", VerifierBinding.of("broken"), null))
                    .isInstanceOf(ConfigurationException.class)
                    .hasRootCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("the binding keeps its own copy of the config")
        void configIsCopied() {
            ObjectNode config = new ObjectMapper().createObjectNode().put("threshold", 1);
            registry.register("docs", new VerifierBinding(ScriptedVerifierFactory.TYPE, config), null);

            config.put("threshold", 99);

            assertThat(registry.lookup("docs").config().get("threshold").asInt()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @Test
        @DisplayName("an unknown domain is DomainNotFound")
        void unknown() {
            assertThatThrownBy(() -> registry.lookup("ghost"))
                    .isInstanceOf(DomainNotFoundException.class)
                    .satisfies(e -> assertThat(((DomainNotFoundException) e).getDomainId()).isEqualTo("ghost"));
        }

        @Test
        @DisplayName("a deactivated domain is rejected, not skipped")
        void deactivated() {
            registry.register("docs", VerifierBinding.of(ScriptedVerifierFactory.TYPE), null);
            registry.deactivate("docs");

            assertThatThrownBy(() -> registry.resolveVerifier("docs"))
                    .isInstanceOf(DomainNotFoundException.class)
                    .satisfies(e -> assertThat(((DomainNotFoundException) e).isInactive()).isTrue());
            assertThat(registry.list()).singleElement().extracting(Domain::active).isEqualTo(false);
        }

        @Test
        @DisplayName("deactivating an unknown domain is DomainNotFound")
        void deactivateUnknown() {
            assertThatThrownBy(() -> registry.deactivate("ghost")).isInstanceOf(DomainNotFoundException.class);
        }
    }

    @Test
    @DisplayName("concurrent registrations of distinct ids all succeed")
    void concurrentRegistration() throws Exception {
        ScriptedVerifierFactory factory = new ScriptedVerifierFactory();
        for (int i = 0; i < 32; i++) {
            factory.with("d" + i, ScriptedVerifier.always("d" + i, Verdict.VERIFIED));
        }
        DomainRegistry shared = new DomainRegistry(List.of(factory));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Domain>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                String id = "d" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return shared.register(id, VerifierBinding.of(ScriptedVerifierFactory.TYPE), null);
                }));
            }
            start.countDown();
            for (Future<Domain> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(shared.list()).hasSize(32);
    }
}

package com.eainde.verify.verifier;

import com.eainde.verify.error.ConfigurationException;
import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.Claim;
import com.eainde.verify.model.ClaimGuidance;
import com.eainde.verify.model.RemediationAction;
import com.eainde.verify.model.RemediationPlan;
import com.eainde.verify.model.Verdict;
import com.eainde.verify.model.VerificationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternRuleVerifierTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PatternRuleVerifierFactory factory = new PatternRuleVerifierFactory();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    private static Claim claim(String statement) {
        return Claim.of("c-1", "security", statement, "Security#1", 1);
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        private DomainVerifier verifier;

        @BeforeEach
        void setUp() throws Exception {
            verifier = factory.create("security", json("""
                    {"rules": [
                      {"id": "tls", "appliesTo": "encrypt", "requires": "TLS\\\\s*1\\\\.[23]", "guidance": "Name the TLS version."},
                      {"id": "cipher", "appliesTo": "encrypt", "requires": "AES-256", "guidance": "Name the cipher."},
                      {"id": "audit", "appliesTo": "log", "requires": "audit log"}
                    ]}
                    """));
        }

        @Test
        @DisplayName("VERIFIED when every applicable rule holds")
        void allSatisfied() {
            VerificationResult result = verifier.verify(claim("Data is encrypted in transit"),
                    Artifact.initial("doc", "We use tls 1.3 and AES-256 everywhere."));

            assertThat(result.verdict()).isEqualTo(Verdict.VERIFIED);
            assertThat(result.evidence()).isEqualTo("Rules satisfied: tls, cipher");
            assertThat(result.oracleId()).isEqualTo("pattern-rule:security");
        }

        @Test
        @DisplayName("PARTIAL when only some applicable rules hold")
        void someSatisfied() {
            VerificationResult result = verifier.verify(claim("Data is encrypted in transit"),
                    Artifact.initial("doc", "We use TLS 1.2."));

            assertThat(result.verdict()).isEqualTo(Verdict.PARTIAL);
            assertThat(PatternRuleVerifier.missingRules(result.evidence())).containsExactly("cipher");
        }

        @Test
        @DisplayName("FALSIFIED when no applicable rule holds")
        void noneSatisfied() {
            VerificationResult result = verifier.verify(claim("Data is encrypted in transit"),
                    Artifact.initial("doc", "Plain HTTP."));

            assertThat(result.verdict()).isEqualTo(Verdict.FALSIFIED);
            assertThat(PatternRuleVerifier.missingRules(result.evidence())).containsExactly("tls", "cipher");
        }

        @Test
        @DisplayName("VERIFIED when no rule applies to the statement")
        void noApplicableRule() {
            VerificationResult result = verifier.verify(claim("The UI is blue"), Artifact.initial("doc", "x"));

            assertThat(result.verdict()).isEqualTo(Verdict.VERIFIED);
            assertThat(result.evidence()).isEqualTo("No rule applies to this claim");
        }

        @Test
        @DisplayName("guidance joins the guidance of the missing rules")
        void remediate() {
            VerificationResult partial = verifier.verify(claim("Data is encrypted in transit"),
                    Artifact.initial("doc", "We use TLS 1.2."));
            VerificationResult auditMissing = new VerificationResult("c-2", Verdict.FALSIFIED,
                    "Rules missing: audit", "pattern-rule:security", null, 1);

            RemediationPlan plan = verifier.remediate(List.of(partial, auditMissing), List.of(), 2);

            assertThat(plan.producedAtIteration()).isEqualTo(2);
            assertThat(plan.guidanceInOrder()).extracting(ClaimGuidance::guidance)
                    .containsExactly("Name the cipher.", "Make the artifact satisfy: Rules missing: audit");
            assertThat(plan.guidanceInOrder()).extracting(ClaimGuidance::action).containsOnly(RemediationAction.ADD);
        }
    }

    @Nested
    @DisplayName("factory")
    class Factory {

        @Test
        @DisplayName("a rule without appliesTo applies to every claim")
        void universalRule() throws Exception {
            DomainVerifier verifier = factory.create("docs", json("""
                    {"rules": [{"id": "owner", "requires": "owner:"}]}
                    """));

            assertThat(verifier.verify(claim("anything"), Artifact.initial("doc", "no owner")).verdict())
                    .isEqualTo(Verdict.FALSIFIED);
        }

        @Test
        @DisplayName("rejects a config without rules")
        void noRules() throws Exception {
            assertThatThrownBy(() -> factory.create("docs", json("{}")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("rules");
        }

        @Test
        @DisplayName("rejects duplicate rule ids")
        void duplicateIds() throws Exception {
            JsonNode config = json("""
                    {"rules": [{"id": "a", "requires": "x"}, {"id": "a", "requires": "y"}]}
                    """);

            assertThatThrownBy(() -> factory.create("docs", config)).isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("rejects a rule without a requires pattern")
        void missingRequires() throws Exception {
            JsonNode config = json("""
                    {"rules": [{"id": "a", "appliesTo": "x"}]}
                    """);

            assertThatThrownBy(() -> factory.create("docs", config)).isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("rejects an invalid regular expression")
        void invalidPattern() throws Exception {
            JsonNode config = json("""
                    {"rules": [{"id": "a", "requires": "(unclosed"}]}
                    """);

            assertThatThrownBy(() -> factory.create("docs", config))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("invalid pattern");
        }
    }
}

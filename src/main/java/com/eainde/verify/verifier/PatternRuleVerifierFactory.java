package com.eainde.verify.verifier;

import com.eainde.verify.error.ConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Builds {@link PatternRuleVerifier}s from
 * {@code {"rules":[{"id","appliesTo","requires","guidance"}]}}.
 */
public class PatternRuleVerifierFactory implements VerifierAdapterFactory {

    public static final String TYPE = "pattern-rule";

    @Override
    public String adapterType() {
        return TYPE;
    }

    @Override
    public DomainVerifier create(String domainId, JsonNode config) {
        JsonNode rulesNode = config.path("rules");
        if (!rulesNode.isArray() || rulesNode.isEmpty()) {
            throw new ConfigurationException("Domain '%s': pattern-rule config needs a non-empty 'rules' array"
                    .formatted(domainId));
        }
        List<PatternRule> rules = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (JsonNode node : rulesNode) {
            String id = node.path("id").asText("");
            if (id.isBlank() || !ids.add(id)) {
                throw new ConfigurationException("Domain '%s': every rule needs a unique 'id' (got '%s')"
                        .formatted(domainId, id));
            }
            if (!node.hasNonNull("requires")) {
                throw new ConfigurationException("Domain '%s': rule '%s' has no 'requires' pattern".formatted(domainId, id));
            }
            rules.add(new PatternRule(
                    id,
                    node.hasNonNull("appliesTo") ? compile(domainId, id, node.get("appliesTo").asText()) : null,
                    compile(domainId, id, node.get("requires").asText()),
                    node.path("guidance").asText(null)));
        }
        return new PatternRuleVerifier(domainId, rules);
    }

    private static Pattern compile(String domainId, String ruleId, String regex) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Domain '%s': rule '%s' has an invalid pattern".formatted(domainId, ruleId), e);
        }
    }
}

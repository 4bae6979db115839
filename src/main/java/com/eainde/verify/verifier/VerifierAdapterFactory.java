package com.eainde.verify.verifier;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Builds a {@link DomainVerifier} for one adapter type from a domain's opaque config blob.
 * Every factory bean in the context is offered to the domain registry.
 */
public interface VerifierAdapterFactory {

    /**
     * Adapter-type tag used in registry records, e.g. {@code "pattern-rule"}.
     */
    String adapterType();

    /**
     * @throws com.eainde.verify.error.ConfigurationException if the config is malformed
     */
    DomainVerifier create(String domainId, JsonNode config);
}

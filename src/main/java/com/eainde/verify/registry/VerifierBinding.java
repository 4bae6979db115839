package com.eainde.verify.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * Adapter type plus the opaque configuration handed to its factory. Owned by exactly one
 * {@link Domain}.
 */
public record VerifierBinding(String adapterType, JsonNode config) {

    public VerifierBinding {
        Objects.requireNonNull(adapterType, "adapterType");
        config = config == null ? JsonNodeFactory.instance.objectNode() : config.deepCopy();
    }

    public static VerifierBinding of(String adapterType) {
        return new VerifierBinding(adapterType, null);
    }
}

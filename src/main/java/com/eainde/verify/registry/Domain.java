package com.eainde.verify.registry;

import java.util.Objects;

/**
 * A registered verification domain.
 */
public record Domain(
        String id,
        VerifierBinding verifierBinding,
        String extractionTemplateRef,
        boolean active
) {

    public static final String DEFAULT_EXTRACTION_TEMPLATE = "declarative-sentences";

    public Domain {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(verifierBinding, "verifierBinding");
        if (extractionTemplateRef == null || extractionTemplateRef.isBlank()) {
            extractionTemplateRef = DEFAULT_EXTRACTION_TEMPLATE;
        }
    }

    Domain deactivated() {
        return new Domain(id, verifierBinding, extractionTemplateRef, false);
    }
}

package com.eainde.verify.extract;

/**
 * What the extractor needs to know about the domain it extracts claims for.
 */
public record DomainContext(String domainId, String extractionTemplateRef, int iteration) {
}

package com.eainde.verify.extract;

import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.Claim;

import java.util.List;

/**
 * Turns an artifact into the ordered set of claims a domain will verify.
 * <p>
 * Implementations are pure: identical input yields identical claims with identical ids.
 * </p>
 */
public interface ClaimExtractor {

    /**
     * @return at least one claim, never an empty list
     * @throws com.eainde.verify.error.ExtractionFailureException if no claim can be derived
     */
    List<Claim> extract(Artifact artifact, DomainContext context);
}

package com.eainde.verify.extract;

import com.eainde.verify.error.ExtractionFailureException;
import com.eainde.verify.error.VerificationException;
import com.eainde.verify.model.Artifact;
import com.eainde.verify.model.Claim;
import com.eainde.verify.registry.Domain;
import com.eainde.verify.registry.DomainRegistry;
import com.eainde.verify.verifier.DomainVerifier;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts the claims of one iteration across every domain of a run.
 * <p>
 * For each domain: template extraction with the domain's {@code extractionTemplateRef}, then
 * the domain verifier's {@code extractClaims} hook. The combined list is validated: not empty
 * per domain, every claim tagged with its own domain, ids unique across the run.
 * </p>
 */
@Log4j2
public class ClaimExtractionService {

    private final ClaimExtractor extractor;
    private final DomainRegistry registry;

    public ClaimExtractionService(ClaimExtractor extractor, DomainRegistry registry) {
        this.extractor = extractor;
        this.registry = registry;
    }

    /**
     * @throws ExtractionFailureException if any domain yields no claims, an invalid claim set, or its extraction throws
     * @throws com.eainde.verify.error.DomainNotFoundException if a domain is unknown or inactive
     */
    public List<Claim> extract(Artifact artifact, List<String> domainIds, int iteration) {
        List<Claim> all = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (String domainId : domainIds) {
            Domain domain = registry.domain(domainId);
            DomainVerifier verifier = registry.resolveVerifier(domainId);
            DomainContext context = new DomainContext(domainId, domain.extractionTemplateRef(), iteration);

            List<Claim> claims = extractClaims(verifier, artifact, context);

            if (claims == null || claims.isEmpty()) {
                throw new ExtractionFailureException(domainId,
                        "Domain '%s' produced no claims for artifact '%s' v%d"
                                .formatted(domainId, artifact.artifactId(), artifact.version()));
            }
            for (Claim claim : claims) {
                if (!domainId.equals(claim.domain())) {
                    throw new ExtractionFailureException(domainId,
                            "Claim %s is tagged with domain '%s' but was extracted for '%s'"
                                    .formatted(claim.id(), claim.domain(), domainId));
                }
                if (!ids.add(claim.id())) {
                    throw new ExtractionFailureException(domainId, "Duplicate claim id " + claim.id());
                }
                all.add(claim.extractedAtIteration() == iteration ? claim : claim.atIteration(iteration));
            }
            log.info("Domain {}: {} claim(s) extracted at iteration {}", domainId, claims.size(), iteration);
        }
        return List.copyOf(all);
    }

    private List<Claim> extractClaims(DomainVerifier verifier, Artifact artifact, DomainContext context) {
        try {
            List<Claim> baseline = extractor.extract(artifact, context);
            return verifier.extractClaims(artifact, context, baseline);
        } catch (VerificationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExtractionFailureException(context.domainId(),
                    "Claim extraction failed for domain '%s': %s".formatted(context.domainId(), e.getMessage()), e);
        }
    }
}

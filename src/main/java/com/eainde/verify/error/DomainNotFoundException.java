package com.eainde.verify.error;

/**
 * A claim references a domain that is not registered or has been deactivated. Run-fatal,
 * since there is no oracle that could judge the claim.
 */
public class DomainNotFoundException extends VerificationException {

    private final String domainId;
    private final boolean inactive;

    public DomainNotFoundException(String domainId) {
        this(domainId, false);
    }

    public DomainNotFoundException(String domainId, boolean inactive) {
        super(inactive
                ? "Domain is deactivated: " + domainId
                : "No domain registered with id: " + domainId);
        this.domainId = domainId;
        this.inactive = inactive;
    }

    public String getDomainId() {
        return domainId;
    }

    public boolean isInactive() {
        return inactive;
    }
}

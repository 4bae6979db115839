package com.eainde.verify.registry;

import com.eainde.verify.error.ConfigurationException;
import com.eainde.verify.error.DomainNotFoundException;
import com.eainde.verify.verifier.DomainVerifier;
import com.eainde.verify.verifier.VerifierAdapterFactory;
import lombok.extern.log4j.Log4j2;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Process-wide mapping from domain id to its verifier binding and extraction template.
 * <p>
 * The only shared mutable state of the engine. It is mutated exclusively through
 * {@link #register} and {@link #deactivate}; writes are serialized by a lock and publish a new
 * immutable map through a volatile field, so lookups never take the lock and never wait on the
 * registration of another domain.
 * </p>
 *
 * <h3>Lifecycle:</h3>
 * <ol>
 * <li>Created empty with every known {@link VerifierAdapterFactory}.</li>
 * <li>{@code DomainRegistryInitializer} registers the configured domains at startup.</li>
 * <li>Runtime callers may register new domains or deactivate existing ones.</li>
 * </ol>
 */
@Log4j2
public class DomainRegistry {

    private final Map<String, VerifierAdapterFactory> factories;
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile Map<String, RegisteredDomain> domains = Map.of();

    public DomainRegistry(List<VerifierAdapterFactory> factories) {
        this.factories = factories.stream()
                .collect(Collectors.toUnmodifiableMap(VerifierAdapterFactory::adapterType, Function.identity()));
        log.info("Domain registry created with adapter types {}", this.factories.keySet());
    }

    // =========================================================================
    //  Mutation
    // =========================================================================

    /**
     * Registers a domain and builds its verifier from the binding.
     *
     * @throws ConfigurationException if the id is already active, the adapter type is unknown,
     *                                or the adapter rejects its configuration
     */
    public Domain register(Domain domain) {
        if (domain.id().isBlank()) {
            throw new ConfigurationException("Domain id must not be blank");
        }
        // Build outside the lock so a slow adapter cannot stall other writers for long.
        DomainVerifier verifier = domain.active() ? createVerifier(domain) : null;

        writeLock.lock();
        try {
            RegisteredDomain existing = domains.get(domain.id());
            if (existing != null && existing.domain().active()) {
                throw new ConfigurationException("Domain already registered: " + domain.id());
            }
            Map<String, RegisteredDomain> next = new LinkedHashMap<>(domains);
            next.put(domain.id(), new RegisteredDomain(domain, verifier));
            domains = Collections.unmodifiableMap(next);
        } finally {
            writeLock.unlock();
        }
        log.info("Registered domain '{}' (adapter={}, template={}, active={})",
                domain.id(), domain.verifierBinding().adapterType(), domain.extractionTemplateRef(), domain.active());
        return domain;
    }

    public Domain register(String domainId, VerifierBinding binding, String extractionTemplateRef) {
        return register(new Domain(domainId, binding, extractionTemplateRef, true));
    }

    /**
     * Marks a domain inactive. The router rejects claims of inactive domains.
     *
     * @throws DomainNotFoundException if no such domain was ever registered
     */
    public void deactivate(String domainId) {
        writeLock.lock();
        try {
            RegisteredDomain existing = domains.get(domainId);
            if (existing == null) {
                throw new DomainNotFoundException(domainId);
            }
            Map<String, RegisteredDomain> next = new LinkedHashMap<>(domains);
            next.put(domainId, new RegisteredDomain(existing.domain().deactivated(), null));
            domains = Collections.unmodifiableMap(next);
        } finally {
            writeLock.unlock();
        }
        log.info("Deactivated domain '{}'", domainId);
    }

    // =========================================================================
    //  Lock-free reads
    // =========================================================================

    /**
     * @throws DomainNotFoundException if the domain is absent or inactive
     */
    public VerifierBinding lookup(String domainId) {
        return activeEntry(domainId).domain().verifierBinding();
    }

    public Domain domain(String domainId) {
        return activeEntry(domainId).domain();
    }

    public DomainVerifier resolveVerifier(String domainId) {
        return activeEntry(domainId).verifier();
    }

    public boolean isActive(String domainId) {
        RegisteredDomain entry = domains.get(domainId);
        return entry != null && entry.domain().active();
    }

    /**
     * All registered domains, active and inactive, in registration order.
     */
    public List<Domain> list() {
        return domains.values().stream()
                .map(RegisteredDomain::domain)
                .toList();
    }

    private RegisteredDomain activeEntry(String domainId) {
        RegisteredDomain entry = domainId == null ? null : domains.get(domainId);
        if (entry == null) {
            throw new DomainNotFoundException(domainId);
        }
        if (!entry.domain().active()) {
            throw new DomainNotFoundException(domainId, true);
        }
        return entry;
    }

    private DomainVerifier createVerifier(Domain domain) {
        VerifierBinding binding = domain.verifierBinding();
        VerifierAdapterFactory factory = factories.get(binding.adapterType());
        if (factory == null) {
            throw new ConfigurationException("Unknown verifier adapter type '%s' for domain '%s' (known: %s)"
                    .formatted(binding.adapterType(), domain.id(), factories.keySet()));
        }
        try {
            DomainVerifier verifier = factory.create(domain.id(), binding.config());
            if (verifier == null) {
                throw new ConfigurationException("Adapter '%s' returned no verifier for domain '%s'"
                        .formatted(binding.adapterType(), domain.id()));
            }
            return verifier;
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigurationException("Failed to build verifier for domain '%s'".formatted(domain.id()), e);
        }
    }

    private record RegisteredDomain(Domain domain, DomainVerifier verifier) {
    }
}

package com.eainde.verify.config;

import com.eainde.verify.registry.DomainRecord;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds {@code verification.*}.
 */
@Data
@ConfigurationProperties(prefix = "verification")
public class VerificationProperties {

    /** Default iteration budget of a run. */
    private int maxIterations = 5;

    /** Claims verified in parallel within one iteration. */
    private int concurrency = 8;

    /** Optional JSON array of domain records loaded at startup, after {@link #domains}. */
    private Path registryFile;

    private List<DomainRecord> domains = new ArrayList<>();

    private Verifier verifier = new Verifier();
    private Remediation remediation = new Remediation();
    private Convergence convergence = new Convergence();
    private Ledger ledger = new Ledger();

    @Data
    public static class Verifier {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class Remediation {
        private int batchSize = 15;
    }

    @Data
    public static class Convergence {
        private boolean partialCountsAsVerified = false;
    }

    @Data
    public static class Ledger {
        /** {@code memory} or {@code jdbc}. */
        private String store = "memory";
    }
}

package com.eainde.verify.config;

import com.eainde.verify.error.GenerationFailureException;
import com.eainde.verify.extract.ClaimExtractionService;
import com.eainde.verify.extract.ClaimExtractor;
import com.eainde.verify.extract.HeuristicClaimExtractor;
import com.eainde.verify.ledger.InMemoryRunLedger;
import com.eainde.verify.ledger.JdbcRunLedger;
import com.eainde.verify.ledger.RunLedger;
import com.eainde.verify.loop.ArtifactGenerator;
import com.eainde.verify.loop.LlmArtifactGenerator;
import com.eainde.verify.loop.LoopController;
import com.eainde.verify.loop.LoopSettings;
import com.eainde.verify.loop.VerificationRunService;
import com.eainde.verify.registry.DomainRegistry;
import com.eainde.verify.registry.DomainRegistryInitializer;
import com.eainde.verify.remediation.Remediator;
import com.eainde.verify.report.RunReportGenerator;
import com.eainde.verify.router.VerifierCallPolicy;
import com.eainde.verify.router.VerifierRouter;
import com.eainde.verify.thread.MdcAwareExecutor;
import com.eainde.verify.verifier.LlmJudgeVerifierFactory;
import com.eainde.verify.verifier.PatternRuleVerifierFactory;
import com.eainde.verify.verifier.VerifierAdapterFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.util.List;

/**
 * Wires the verification loop.
 * <p>
 * Every collaborator can be replaced by declaring a bean of the same type. Verifier adapters are
 * contributed as {@link VerifierAdapterFactory} beans; all of them are handed to the registry.
 * </p>
 */
@Log4j2
@Configuration
@EnableConfigurationProperties(VerificationProperties.class)
public class VerificationLoopConfig {

    // =========================================================================
    //  Domains and adapters
    // =========================================================================

    @Bean
    public PatternRuleVerifierFactory patternRuleVerifierFactory() {
        return new PatternRuleVerifierFactory();
    }

    @Bean
    public LlmJudgeVerifierFactory llmJudgeVerifierFactory(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        return new LlmJudgeVerifierFactory(chatModel, objectMapper);
    }

    @Bean
    public DomainRegistry domainRegistry(List<VerifierAdapterFactory> factories) {
        return new DomainRegistry(factories);
    }

    /**
     * Registers the configured domains while the context starts, so a bad record fails startup.
     */
    @Bean
    public DomainRegistryInitializer domainRegistryInitializer(DomainRegistry registry,
                                                               ObjectMapper objectMapper,
                                                               VerificationProperties properties) {
        DomainRegistryInitializer initializer = new DomainRegistryInitializer(registry, objectMapper);
        initializer.initialize(properties.getDomains(), properties.getRegistryFile());
        return initializer;
    }

    // =========================================================================
    //  Extraction, routing, remediation
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean(ClaimExtractor.class)
    public ClaimExtractor claimExtractor() {
        return new HeuristicClaimExtractor();
    }

    @Bean
    public ClaimExtractionService claimExtractionService(ClaimExtractor claimExtractor,
                                                         DomainRegistry registry,
                                                         DomainRegistryInitializer domainRegistryInitializer) {
        return new ClaimExtractionService(claimExtractor, registry);
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor adapterExecutor() {
        return MdcAwareExecutor.cached("verifier-adapter");
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor claimExecutor(VerificationProperties properties) {
        return MdcAwareExecutor.fixed("claim-verify", properties.getConcurrency());
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor runExecutor() {
        return MdcAwareExecutor.cached("verification-run");
    }

    @Bean
    public VerifierRouter verifierRouter(DomainRegistry registry,
                                         @Qualifier("adapterExecutor") MdcAwareExecutor adapterExecutor,
                                         VerificationProperties properties) {
        VerificationProperties.Verifier v = properties.getVerifier();
        return new VerifierRouter(registry, adapterExecutor,
                new VerifierCallPolicy(v.getTimeout(), v.getMaxAttempts(), v.getInitialBackoff(), v.getBackoffMultiplier()));
    }

    @Bean
    public Remediator remediator(DomainRegistry registry, VerificationProperties properties) {
        return new Remediator(registry, properties.getRemediation().getBatchSize());
    }

    // =========================================================================
    //  Ledger
    // =========================================================================

    @Bean
    @ConditionalOnProperty(prefix = "verification.ledger", name = "store", havingValue = "jdbc")
    public RunLedger jdbcRunLedger(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        log.info("Using JDBC run ledger");
        return new JdbcRunLedger(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(RunLedger.class)
    public RunLedger inMemoryRunLedger() {
        return new InMemoryRunLedger();
    }

    // =========================================================================
    //  Loop
    // =========================================================================

    @Bean
    @ConditionalOnMissingBean(ArtifactGenerator.class)
    public ArtifactGenerator artifactGenerator(ObjectProvider<ChatModel> chatModel) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.warn("No ChatModel and no ArtifactGenerator bean configured; runs that need remediation will fail");
            return (previous, plan) -> {
                throw new GenerationFailureException("No artifact generator configured");
            };
        }
        return new LlmArtifactGenerator(model);
    }

    @Bean
    public LoopController loopController(ClaimExtractionService claimExtractionService,
                                         VerifierRouter verifierRouter,
                                         Remediator remediator,
                                         ArtifactGenerator artifactGenerator,
                                         RunLedger runLedger,
                                         @Qualifier("claimExecutor") MdcAwareExecutor claimExecutor,
                                         VerificationProperties properties) {
        LoopSettings settings = new LoopSettings(
                properties.getMaxIterations(),
                properties.getConvergence().isPartialCountsAsVerified(),
                Duration.ofMillis(100));
        return new LoopController(claimExtractionService, verifierRouter, remediator, artifactGenerator,
                runLedger, claimExecutor, settings);
    }

    @Bean
    public VerificationRunService verificationRunService(LoopController loopController,
                                                         @Qualifier("runExecutor") MdcAwareExecutor runExecutor) {
        return new VerificationRunService(loopController, runExecutor);
    }

    @Bean
    public RunReportGenerator runReportGenerator() {
        return new RunReportGenerator();
    }
}

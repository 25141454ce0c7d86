package com.vidnyan.tfguard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.tfguard.application.port.out.PolicyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for TF Guard components.
 */
@Slf4j
@Configuration
public class TfGuardConfiguration {

    public static final String POLICY_EXECUTOR = "policyExecutor";
    public static final String AI_EXECUTOR = "aiExecutor";
    public static final String AUDIT_EXECUTOR = "auditExecutor";

    /**
     * ObjectMapper for REST payloads and AI answers.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean(name = POLICY_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService policyExecutor(TfGuardProperties properties) {
        return Executors.newFixedThreadPool(properties.getAudit().getPolicyThreads(), namedThreads("policy"));
    }

    /**
     * Runs whole audits side by side, e.g. both sides of a comparison.
     * Kept apart from the policy pool since audits block on policy tasks.
     */
    @Bean(name = AUDIT_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService auditExecutor() {
        return Executors.newFixedThreadPool(2, namedThreads("audit"));
    }

    @Bean(name = AI_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService aiExecutor(TfGuardProperties properties) {
        return Executors.newFixedThreadPool(properties.getRemediation().getAiThreads(), namedThreads("ai-fix"));
    }

    /**
     * Log registered policies on startup.
     */
    @Bean
    public String logPolicies(PolicyRepository policyRepository) {
        log.info("Registered {} policies:", policyRepository.findAll().size());
        policyRepository.findAll().forEach(p ->
                log.info("  - {} [{} / {}] {}", p.code(), p.category(), p.severity(), p.name()));
        return "policies-logged";
    }

    private static java.util.concurrent.ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

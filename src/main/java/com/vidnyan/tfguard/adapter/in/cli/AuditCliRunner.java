package com.vidnyan.tfguard.adapter.in.cli;

import com.vidnyan.tfguard.application.port.in.AuditUseCase;
import com.vidnyan.tfguard.application.port.in.CompareUseCase;
import com.vidnyan.tfguard.config.TfGuardProperties;
import com.vidnyan.tfguard.domain.audit.AuditResult;
import com.vidnyan.tfguard.domain.audit.AuditSummary;
import com.vidnyan.tfguard.domain.audit.CostBreakdown;
import com.vidnyan.tfguard.domain.audit.PolicyViolations;
import com.vidnyan.tfguard.domain.delta.DiffResult;
import com.vidnyan.tfguard.domain.policy.PolicyResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * CLI runner for one-shot audits.
 * Runs when tfguard.audit.path is set, then shuts the application down.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditCliRunner implements CommandLineRunner {

    private static final int MAX_DETAILS = 100;

    private final AuditUseCase auditUseCase;
    private final CompareUseCase compareUseCase;
    private final TfGuardProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) throws Exception {
        String path = properties.getAudit().getPath();
        if (path == null || path.isBlank()) {
            log.info("No template path specified. Set tfguard.audit.path to audit a file.");
            return;
        }

        int exitCode = 0;
        try {
            String provider = properties.getAudit().getProvider();
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║           TF Guard - Terraform Policy Audit                  ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Auditing: {}", truncatePath(path, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            String content = Files.readString(Path.of(path));
            AuditResult result = auditUseCase.audit(Path.of(path).getFileName().toString(), content, provider);
            printResults(result);

            String comparePath = properties.getAudit().getComparePath();
            if (comparePath != null && !comparePath.isBlank()) {
                String other = Files.readString(Path.of(comparePath));
                printDelta(compareUseCase.compare(content, other, provider), comparePath);
            }

            log.info("");
            log.info("Audit complete!");
        } catch (Exception e) {
            log.error("Audit of {} failed: {}", path, e.getMessage());
            exitCode = 1;
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printResults(AuditResult result) {
        AuditSummary summary = result.summary();
        CostBreakdown cost = result.costBreakdown();

        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" AUDIT RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Resources:        {}", result.resourceCount());
        log.info(" Passed checks:    {}", summary.passedChecks());
        log.info(" Security score:   {}/100", summary.score());
        log.info(" Monthly cost:     ${} ({})", cost.totalMonthly(), cost.region());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" VIOLATIONS:");
        log.info("   🔴 Critical: {}", summary.critical());
        log.info("   🟠 High:     {}", summary.high());
        log.info("   🟡 Medium:   {}", summary.medium());
        log.info("   🔵 Low:      {}", summary.low());
        log.info("   ⚪ Info:     {}", summary.info());
        log.info("═══════════════════════════════════════════════════════════════");

        if (!cost.byService().isEmpty()) {
            log.info("");
            log.info(" COST BY SERVICE:");
            for (Map.Entry<String, Double> entry : cost.byService().entrySet()) {
                log.info("   {} ${}", String.format("%-14s", entry.getKey()), entry.getValue());
            }
            cost.unestimated().forEach(r -> log.info("   ? {} could not be priced", r.resourceRef()));
        }

        if (result.violations().isEmpty()) {
            log.info("");
            log.info("✅ No violations found! Your template is clean.");
            return;
        }

        log.info("");
        log.info(" VIOLATION DETAILS:");
        log.info("───────────────────────────────────────────────────────────────");

        int count = 0;
        for (PolicyViolations group : result.violations()) {
            for (PolicyResult v : group.results()) {
                if (++count > MAX_DETAILS) {
                    log.info(" ... and {} more violations", summary.totalIssues() - MAX_DETAILS);
                    return;
                }
                log.info("");
                log.info(" {} [{}] {}", badge(group), group.policyCode(), group.policyName());
                log.info(" Resource: {}{}", v.resourceRef(), v.line() != null ? " (line " + v.line() + ")" : "");
                log.info(" Message:  {}", v.message());
                if (v.suggestion() != null) {
                    log.info(" Fix:      {}{}", v.suggestion(), v.autoFixable() ? " [auto-fixable]" : "");
                }
            }
        }
    }

    private void printDelta(DiffResult diff, String comparePath) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" COMPARISON WITH {}", truncatePath(comparePath, 45));
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Score:          {} -> {}", diff.oldScore(), diff.newScore());
        log.info(" Monthly cost:   ${} -> ${} ({}{})", diff.oldMonthlyCost(), diff.newMonthlyCost(),
                diff.costDelta() >= 0 ? "+" : "", diff.costDelta());
        log.info(" New issues:     {}", diff.securityDelta().newCount());
        log.info(" Fixed issues:   {}", diff.securityDelta().fixedCount());
        if (!diff.patch().isEmpty()) {
            log.info("───────────────────────────────────────────────────────────────");
            diff.patch().lines().forEach(line -> log.info(" {}", line));
        }
    }

    private static String badge(PolicyViolations group) {
        return switch (group.severity()) {
            case CRITICAL -> "🔴 CRITICAL";
            case HIGH -> "🟠 HIGH";
            case MEDIUM -> "🟡 MEDIUM";
            case LOW -> "🔵 LOW";
            case INFO -> "⚪ INFO";
        };
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}

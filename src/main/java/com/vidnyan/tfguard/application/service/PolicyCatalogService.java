package com.vidnyan.tfguard.application.service;

import com.vidnyan.tfguard.application.port.in.PolicyCatalogUseCase;
import com.vidnyan.tfguard.application.port.out.PolicyActivation;
import com.vidnyan.tfguard.application.port.out.PolicyRepository;
import com.vidnyan.tfguard.domain.exception.NotFoundException;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyCatalogService implements PolicyCatalogUseCase {

    private static final Comparator<PolicyDefinition> CATALOG_ORDER =
            Comparator.comparing(PolicyDefinition::category)
                    .thenComparing(PolicyDefinition::severity)
                    .thenComparing(PolicyDefinition::code);

    private final PolicyRepository policyRepository;
    private final PolicyActivation policyActivation;

    /**
     * All policies applying to the provider, or every policy when provider is null.
     * Ordered by category, then severity (most severe first), then code.
     */
    @Override
    public List<PolicyEntry> listPolicies(String provider) {
        return policyRepository.findAll().stream()
                .filter(p -> provider == null || provider.isBlank() || p.appliesTo(provider))
                .sorted(CATALOG_ORDER)
                .map(p -> PolicyEntry.of(p, policyActivation.isEnabled(p.code())))
                .toList();
    }

    @Override
    public PolicyEntry setEnabled(String code, boolean enabled) {
        PolicyDefinition policy = policyRepository.findByCode(code)
                .orElseThrow(() -> NotFoundException.of("Policy", code));
        policyActivation.setEnabled(code, enabled);
        log.info("Policy {} {}", code, enabled ? "enabled" : "disabled");
        return PolicyEntry.of(policy, enabled);
    }
}

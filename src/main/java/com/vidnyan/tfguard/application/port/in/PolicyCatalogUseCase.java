package com.vidnyan.tfguard.application.port.in;

import com.vidnyan.tfguard.domain.policy.PolicyDefinition;

import java.util.List;

/**
 * Browse policies and switch them on or off.
 */
public interface PolicyCatalogUseCase {

    List<PolicyEntry> listPolicies(String provider);

    PolicyEntry setEnabled(String code, boolean enabled);

    /**
     * Catalog view of a policy.
     */
    record PolicyEntry(
        String code,
        String name,
        String description,
        String provider,
        PolicyDefinition.Category category,
        PolicyDefinition.Severity severity,
        boolean enabled
    ) {
        public static PolicyEntry of(PolicyDefinition policy, boolean enabled) {
            return new PolicyEntry(policy.code(), policy.name(), policy.description(),
                    policy.provider(), policy.category(), policy.severity(), enabled);
        }
    }
}

package com.vidnyan.tfguard.application.port.out;

import com.vidnyan.tfguard.domain.policy.PolicyDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Port for the policy catalog.
 */
public interface PolicyRepository {

    /**
     * All registered policies, in registration order.
     */
    List<PolicyDefinition> findAll();

    Optional<PolicyDefinition> findByCode(String code);

    List<PolicyDefinition> findByCategory(PolicyDefinition.Category category);

    /**
     * Enabled policies scoped to the provider or to all providers.
     */
    List<PolicyDefinition> getActive(String provider);
}

package com.vidnyan.tfguard.adapter.out.policy;

import com.vidnyan.tfguard.adapter.out.policy.aws.AwsCostPolicies;
import com.vidnyan.tfguard.adapter.out.policy.aws.AwsSecurityPolicies;
import com.vidnyan.tfguard.application.port.out.PolicyActivation;
import com.vidnyan.tfguard.application.port.out.PolicyRepository;
import com.vidnyan.tfguard.domain.policy.PolicyDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Policy catalog built from the compiled-in policy sets.
 * The list is fixed at construction; only activation changes at runtime.
 */
@Slf4j
@Component
public class BuiltInPolicyRepository implements PolicyRepository {

    private final List<PolicyDefinition> policies;
    private final PolicyActivation activation;

    @Autowired
    public BuiltInPolicyRepository(PolicyActivation activation) {
        this(builtInPolicies(), activation);
    }

    public BuiltInPolicyRepository(List<PolicyDefinition> policies, PolicyActivation activation) {
        Set<String> codes = new HashSet<>();
        for (PolicyDefinition policy : policies) {
            if (!codes.add(policy.code())) {
                throw new IllegalStateException("Duplicate policy code: " + policy.code());
            }
        }
        this.policies = List.copyOf(policies);
        this.activation = activation;
        log.info("Loaded {} built-in policies", this.policies.size());
    }

    public static List<PolicyDefinition> builtInPolicies() {
        List<PolicyDefinition> all = new ArrayList<>(AwsSecurityPolicies.policies());
        all.addAll(AwsCostPolicies.policies());
        return all;
    }

    @Override
    public List<PolicyDefinition> findAll() {
        return policies;
    }

    @Override
    public Optional<PolicyDefinition> findByCode(String code) {
        return policies.stream()
                .filter(p -> p.code().equals(code))
                .findFirst();
    }

    @Override
    public List<PolicyDefinition> findByCategory(PolicyDefinition.Category category) {
        return policies.stream()
                .filter(p -> p.category() == category)
                .toList();
    }

    @Override
    public List<PolicyDefinition> getActive(String provider) {
        return policies.stream()
                .filter(p -> p.appliesTo(provider))
                .filter(p -> activation.isEnabled(p.code()))
                .toList();
    }
}

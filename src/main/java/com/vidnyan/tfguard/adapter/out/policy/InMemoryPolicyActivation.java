package com.vidnyan.tfguard.adapter.out.policy;

import com.vidnyan.tfguard.application.port.out.PolicyActivation;
import com.vidnyan.tfguard.config.TfGuardProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Policy switches held in memory, seeded from {@code tfguard.policies.disabled}.
 * Every policy is enabled unless switched off.
 */
@Slf4j
@Component
public class InMemoryPolicyActivation implements PolicyActivation {

    private final Set<String> disabled = ConcurrentHashMap.newKeySet();

    @Autowired
    public InMemoryPolicyActivation(TfGuardProperties properties) {
        this(properties.getPolicies().getDisabled());
    }

    public InMemoryPolicyActivation(Collection<String> initiallyDisabled) {
        initiallyDisabled.stream()
                .map(String::trim)
                .filter(code -> !code.isEmpty())
                .forEach(disabled::add);
        if (!disabled.isEmpty()) {
            log.info("Policies disabled by configuration: {}", disabled);
        }
    }

    @Override
    public boolean isEnabled(String policyCode) {
        return !disabled.contains(policyCode);
    }

    @Override
    public void setEnabled(String policyCode, boolean enabled) {
        if (enabled) {
            disabled.remove(policyCode);
        } else {
            disabled.add(policyCode);
        }
        log.info("Policy {} {}", policyCode, enabled ? "enabled" : "disabled");
    }
}

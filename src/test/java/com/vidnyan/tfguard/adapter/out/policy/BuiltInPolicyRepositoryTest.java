package com.vidnyan.tfguard.adapter.out.policy;

import com.vidnyan.tfguard.domain.policy.PolicyDefinition;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BuiltInPolicyRepositoryTest {

    private static PolicyDefinition policy(String code, String provider) {
        return PolicyDefinition.builder()
                .code(code)
                .name(code)
                .provider(provider)
                .check(ctx -> List.of())
                .build();
    }

    @Test
    void constructor_ShouldRejectDuplicateCodes() {
        List<PolicyDefinition> policies = List.of(policy("X001", "aws"), policy("X001", "aws"));

        assertThrows(IllegalStateException.class,
                () -> new BuiltInPolicyRepository(policies, new InMemoryPolicyActivation(List.of())));
    }

    @Test
    void builtInPolicies_ShouldHaveUniqueCodes() {
        List<PolicyDefinition> policies = BuiltInPolicyRepository.builtInPolicies();
        Set<String> codes = new HashSet<>();
        policies.forEach(p -> codes.add(p.code()));

        assertEquals(25, policies.size());
        assertEquals(policies.size(), codes.size());
    }

    @Test
    void getActive_ShouldFilterByProviderAndActivation() {
        InMemoryPolicyActivation activation = new InMemoryPolicyActivation(List.of("A002"));
        BuiltInPolicyRepository repository = new BuiltInPolicyRepository(List.of(
                policy("A001", "aws"),
                policy("A002", "aws"),
                policy("G001", "gcp"),
                policy("ALL001", PolicyDefinition.ALL_PROVIDERS)), activation);

        assertEquals(List.of("A001", "ALL001"), codes(repository.getActive("aws")));
        assertEquals(List.of("G001", "ALL001"), codes(repository.getActive("gcp")));

        activation.setEnabled("A002", true);
        activation.setEnabled("ALL001", false);

        assertEquals(List.of("A001", "A002"), codes(repository.getActive("aws")));
    }

    @Test
    void findByCode_ShouldReturnEmptyForUnknownCode() {
        BuiltInPolicyRepository repository = new BuiltInPolicyRepository(new InMemoryPolicyActivation(List.of()));

        assertTrue(repository.findByCode("SEC001").isPresent());
        assertTrue(repository.findByCode("NOPE").isEmpty());
        assertEquals(6, repository.findByCategory(PolicyDefinition.Category.COST).size());
    }

    private static List<String> codes(List<PolicyDefinition> policies) {
        return policies.stream().map(PolicyDefinition::code).toList();
    }
}

package com.vidnyan.tfguard;

import com.vidnyan.tfguard.application.port.in.AuditUseCase;
import com.vidnyan.tfguard.application.port.out.PolicyRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "tfguard.ai.api-key=")
class TfGuardApplicationTest {

    @Autowired
    private PolicyRepository policyRepository;

    @Autowired
    private AuditUseCase auditUseCase;

    @Test
    void contextLoads_ShouldRegisterBuiltInPolicies() {
        assertEquals(25, policyRepository.findAll().size());
        assertEquals(100, auditUseCase.audit("""
                resource "aws_cloudtrail" "main" {
                  enable_log_file_validation = true
                }
                """, "aws").score());
    }
}

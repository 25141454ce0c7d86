package com.vidnyan.tfguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TF Guard - policy-driven audit and remediation for Terraform configuration.
 */
@SpringBootApplication
public class TfGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(TfGuardApplication.class, args);
    }
}

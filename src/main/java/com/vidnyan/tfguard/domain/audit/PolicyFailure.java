package com.vidnyan.tfguard.domain.audit;

/**
 * A policy that threw during an audit and was excluded from the results.
 */
public record PolicyFailure(String policyCode, String error) {
}

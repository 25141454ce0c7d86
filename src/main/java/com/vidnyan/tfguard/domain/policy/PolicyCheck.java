package com.vidnyan.tfguard.domain.policy;

import java.util.List;

/**
 * Pure check over a parsed configuration. The same context must always
 * produce the same results.
 */
@FunctionalInterface
public interface PolicyCheck {

    List<PolicyResult> check(PolicyContext context);
}

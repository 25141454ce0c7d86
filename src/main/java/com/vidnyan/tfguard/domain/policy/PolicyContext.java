package com.vidnyan.tfguard.domain.policy;

import com.vidnyan.tfguard.domain.model.ParsedConfig;

/**
 * Input handed to every policy check.
 */
public record PolicyContext(
    ParsedConfig parsed,
    String provider,
    String rawContent
) {

    public static PolicyContext of(ParsedConfig parsed, String provider) {
        return new PolicyContext(parsed, provider, parsed.rawContent());
    }
}

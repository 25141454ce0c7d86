package com.vidnyan.tfguard.application.port.out;

import com.vidnyan.tfguard.domain.model.ParsedConfig;

/**
 * Port for turning configuration text into resource records.
 * Implemented by adapters (e.g., the brace-scanning HCL adapter).
 */
public interface ConfigParser {

    /**
     * Parse configuration text. Fragments that cannot be read are omitted;
     * only a null input is rejected.
     *
     * @param content raw configuration text
     * @return parsed configuration, never null
     * @throws com.vidnyan.tfguard.domain.exception.ParseFailureException if content is null
     */
    ParsedConfig parse(String content);
}

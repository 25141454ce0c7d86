package com.vidnyan.tfguard.application.port.in;

import com.vidnyan.tfguard.domain.delta.DiffResult;

/**
 * Compare two versions of a configuration.
 */
public interface CompareUseCase {

    DiffResult compare(String oldContent, String newContent, String provider);
}

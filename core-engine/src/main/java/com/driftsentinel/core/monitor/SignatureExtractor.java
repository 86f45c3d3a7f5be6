package com.driftsentinel.core.monitor;

import com.driftsentinel.core.error.ScanException;
import com.driftsentinel.core.model.SignatureSet;

import java.nio.file.Path;

/**
 * Supplies the signatures currently observed in one project file. Backed by
 * external code-analysis tooling.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SignatureExtractor {

    /**
     * @param projectRoot monitored project root
     * @param filePath    project-relative file path
     * @return observed signatures; empty if the file declares none
     * @throws ScanException if the file cannot be analysed
     */
    SignatureSet extract(Path projectRoot, String filePath);
}

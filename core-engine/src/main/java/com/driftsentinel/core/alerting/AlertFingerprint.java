package com.driftsentinel.core.alerting;

import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.DriftType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Stable de-duplication key for alerts: SHA-256 over alert type, file path,
 * specification reference and drift type.
 *
 * @since 1.0.0
 */
public final class AlertFingerprint {

    private AlertFingerprint() {
    }

    /**
     * @param type          alert type; must not be {@code null}
     * @param filePath      file path; may be {@code null}
     * @param specReference specification reference; may be {@code null}
     * @param driftType     drift type; may be {@code null}
     * @return 64-character lowercase hex digest
     */
    public static String of(AlertType type, String filePath, String specReference, DriftType driftType) {
        Objects.requireNonNull(type, "Alert type must not be null");
        String key = type.name()
                + '|' + Objects.toString(filePath, "")
                + '|' + Objects.toString(specReference, "")
                + '|' + (driftType != null ? driftType.name() : "");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

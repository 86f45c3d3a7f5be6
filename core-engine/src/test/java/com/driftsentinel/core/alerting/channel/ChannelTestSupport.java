package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.AlertType;
import com.driftsentinel.core.model.DriftType;

import java.time.Instant;
import java.util.Map;

final class ChannelTestSupport {

    static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private ChannelTestSupport() {
    }

    static Alert alert(String id) {
        return Alert.builder()
                .id(id)
                .createdAt(NOW)
                .type(AlertType.DRIFT)
                .severity(AlertSeverity.ERROR)
                .title("SIGNATURE_MISMATCH in src/calc.py")
                .message("'calc' parameter count differs from specification")
                .fingerprint("fp-" + id)
                .filePath("src/calc.py")
                .specReference("calc-spec@docs/calc.md")
                .driftType(DriftType.SIGNATURE_MISMATCH)
                .context(Map.of("elements", "calc"))
                .build();
    }
}

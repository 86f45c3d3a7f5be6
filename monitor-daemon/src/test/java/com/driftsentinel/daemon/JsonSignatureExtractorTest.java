package com.driftsentinel.daemon;

import com.driftsentinel.core.alerting.JsonSupport;
import com.driftsentinel.core.error.ScanException;
import com.driftsentinel.core.model.ObservedSignature;
import com.driftsentinel.core.model.SignatureSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonSignatureExtractor}.
 */
class JsonSignatureExtractorTest {

    @TempDir
    Path projectDir;

    @Test
    @DisplayName("Should return the recorded signatures of a file")
    void shouldExtractRecordedSignatures() throws IOException {
        Path snapshot = writeSnapshot("{\"files\":{\"src/calc.py\":{"
                + "\"calc\":{\"signature\":\"calc(a, b)\",\"behaviorHash\":\"b-1\",\"lineNumber\":3}}}}");
        JsonSignatureExtractor extractor = new JsonSignatureExtractor(snapshot, JsonSupport.newObjectMapper());

        SignatureSet signatures = extractor.extract(projectDir, "src/calc.py");

        ObservedSignature calc = signatures.get("calc").orElseThrow();
        assertThat(calc.getSignature()).isEqualTo("calc(a, b)");
        assertThat(calc.getBehaviorHash()).isEqualTo("b-1");
        assertThat(calc.getLineNumber()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should return an empty set for a file missing from the snapshot")
    void shouldReturnEmptyForUnknownFile() throws IOException {
        Path snapshot = writeSnapshot("{\"files\":{}}");
        JsonSignatureExtractor extractor = new JsonSignatureExtractor(snapshot, JsonSupport.newObjectMapper());

        assertThat(extractor.extract(projectDir, "src/other.py").asMap()).isEmpty();
    }

    @Test
    @DisplayName("Should reload the snapshot after it changes on disk")
    void shouldReloadChangedSnapshot() throws IOException {
        Path snapshot = writeSnapshot("{\"files\":{\"a.py\":{\"f\":{\"signature\":\"f()\"}}}}");
        Files.setLastModifiedTime(snapshot, FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));
        JsonSignatureExtractor extractor = new JsonSignatureExtractor(snapshot, JsonSupport.newObjectMapper());
        assertThat(extractor.extract(projectDir, "a.py").get("f").orElseThrow().getSignature()).isEqualTo("f()");

        writeSnapshot("{\"files\":{\"a.py\":{\"f\":{\"signature\":\"f(x)\"}}}}");
        Files.setLastModifiedTime(snapshot, FileTime.from(Instant.parse("2024-01-01T00:01:00Z")));

        assertThat(extractor.extract(projectDir, "a.py").get("f").orElseThrow().getSignature()).isEqualTo("f(x)");
    }

    @Test
    @DisplayName("Should raise a ScanException when the snapshot is missing or unreadable")
    void shouldFailForMissingOrCorruptSnapshot() throws IOException {
        JsonSignatureExtractor missing = new JsonSignatureExtractor(
                projectDir.resolve("absent.json"), JsonSupport.newObjectMapper());
        assertThatThrownBy(() -> missing.extract(projectDir, "a.py"))
                .isInstanceOf(ScanException.class)
                .hasMessageContaining("Cannot read signature snapshot");

        Path corrupt = writeSnapshot("{\"files\": [");
        JsonSignatureExtractor broken = new JsonSignatureExtractor(corrupt, JsonSupport.newObjectMapper());
        assertThatThrownBy(() -> broken.extract(projectDir, "a.py"))
                .isInstanceOf(ScanException.class);
    }

    // ---- Helpers

    private Path writeSnapshot(String json) throws IOException {
        return Files.writeString(projectDir.resolve("signatures.json"), json);
    }
}

package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.alerting.JsonSupport;
import com.driftsentinel.core.error.ChannelDeliveryException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FileChannel}.
 */
class FileChannelTest {

    private final ObjectMapper mapper = JsonSupport.newObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should append one JSON line per alert")
    void shouldAppendJsonLines() throws IOException {
        Path file = tempDir.resolve("out/alerts.jsonl");
        FileChannel channel = new FileChannel("file", file, mapper);

        assertThat(channel.send(ChannelTestSupport.alert("a-1")).isSuccess()).isTrue();
        assertThat(channel.send(ChannelTestSupport.alert("a-2")).isSuccess()).isTrue();

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);
        JsonNode first = mapper.readTree(lines.get(0));
        assertThat(first.get("id").asText()).isEqualTo("a-1");
        assertThat(first.get("createdAt").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(first.get("driftType").asText()).isEqualTo("SIGNATURE_MISMATCH");
    }

    @Test
    @DisplayName("Should raise a delivery exception when the file cannot be written")
    void shouldFailWhenUnwritable() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("a-directory"));
        FileChannel channel = new FileChannel("file", directory, mapper);

        assertThatThrownBy(() -> channel.send(ChannelTestSupport.alert("a-1")))
                .isInstanceOf(ChannelDeliveryException.class);
    }
}

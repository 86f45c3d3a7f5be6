package com.driftsentinel.core.alerting.channel;

import com.driftsentinel.core.error.ChannelDeliveryException;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.DeliveryResult;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Appends each alert as one JSON line.
 *
 * @since 1.0.0
 */
public class FileChannel implements ChannelHandler {

    private final String name;
    private final Path path;
    private final ObjectMapper mapper;

    public FileChannel(String name, Path path, ObjectMapper mapper) {
        this.name = Objects.requireNonNull(name, "Channel name must not be null");
        this.path = Objects.requireNonNull(path, "Path must not be null");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DeliveryResult send(Alert alert) {
        try {
            String line = mapper.writeValueAsString(alert);
            synchronized (this) {
                Path parent = path.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    w.write(line);
                    w.newLine();
                }
            }
        } catch (IOException e) {
            throw new ChannelDeliveryException("Failed to append alert to " + path + ": " + e.getMessage(), e);
        }
        return DeliveryResult.success(name);
    }

    public Path getPath() {
        return path;
    }
}

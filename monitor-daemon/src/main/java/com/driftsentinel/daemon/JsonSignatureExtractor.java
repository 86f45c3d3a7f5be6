package com.driftsentinel.daemon;

import com.driftsentinel.core.error.ScanException;
import com.driftsentinel.core.model.ObservedSignature;
import com.driftsentinel.core.model.SignatureSet;
import com.driftsentinel.core.monitor.SignatureExtractor;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads observed signatures from the JSON snapshot written by external
 * code-analysis tooling:
 *
 * <pre>
 * { "files": { "src/Foo.java": { "Foo.bar": { "signature": "...", "behaviorHash": "...",
 *                                              "docHash": "...", "lineNumber": 12 } } } }
 * </pre>
 *
 * <p>
 * The snapshot is re-read whenever its modification time changes. A file that
 * has no entry yields an empty {@link SignatureSet}.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonSignatureExtractor implements SignatureExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(JsonSignatureExtractor.class);

    private final Path snapshotPath;
    private final ObjectMapper mapper;

    private FileTime loadedAt;
    private Snapshot snapshot;

    public JsonSignatureExtractor(Path snapshotPath, ObjectMapper mapper) {
        this.snapshotPath = Objects.requireNonNull(snapshotPath, "snapshotPath must not be null");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
    }

    @Override
    public SignatureSet extract(Path projectRoot, String filePath) {
        Map<String, ObservedSignature> signatures = current(filePath).files.get(filePath);
        if (signatures == null) {
            LOG.trace("No signatures recorded for {}", filePath);
            return SignatureSet.empty();
        }
        return new SignatureSet(signatures);
    }

    private synchronized Snapshot current(String filePath) {
        try {
            FileTime modified = Files.getLastModifiedTime(snapshotPath);
            if (snapshot == null || !modified.equals(loadedAt)) {
                Snapshot loaded = mapper.readValue(snapshotPath.toFile(), Snapshot.class);
                if (loaded.files == null) {
                    loaded.files = new LinkedHashMap<>();
                }
                snapshot = loaded;
                loadedAt = modified;
                LOG.debug("Loaded signature snapshot {} ({} file(s))", snapshotPath, snapshot.files.size());
            }
            return snapshot;
        } catch (IOException e) {
            throw new ScanException(filePath,
                    "Cannot read signature snapshot " + snapshotPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Jackson binding for the snapshot document.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Snapshot {
        public Map<String, Map<String, ObservedSignature>> files = new LinkedHashMap<>();
    }
}

package com.driftsentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the signatures observed in one file, keyed by element
 * id.
 *
 * <p>
 * A scan reads a single snapshot from start to finish, so concurrent updates by
 * the extractor can never tear a report.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignatureSet {

    private static final SignatureSet EMPTY = new SignatureSet(Map.of());

    private final Map<String, ObservedSignature> signatures;

    public SignatureSet(Map<String, ObservedSignature> signatures) {
        Objects.requireNonNull(signatures, "Signatures must not be null");
        this.signatures = Collections.unmodifiableMap(new LinkedHashMap<>(signatures));
    }

    public static SignatureSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder preserving insertion order.
     */
    public static class Builder {
        private final Map<String, ObservedSignature> signatures = new LinkedHashMap<>();

        public Builder put(String id, ObservedSignature signature) {
            signatures.put(Objects.requireNonNull(id, "Signature id must not be null"),
                    Objects.requireNonNull(signature, "Signature must not be null"));
            return this;
        }

        public Builder put(String id, String signature) {
            return put(id, ObservedSignature.of(signature));
        }

        public SignatureSet build() {
            return new SignatureSet(signatures);
        }
    }

    public Optional<ObservedSignature> get(String id) {
        return Optional.ofNullable(signatures.get(id));
    }

    public Map<String, ObservedSignature> asMap() {
        return signatures;
    }

    public int size() {
        return signatures.size();
    }

    public boolean isEmpty() {
        return signatures.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignatureSet that))
            return false;
        return signatures.equals(that.signatures);
    }

    @Override
    public int hashCode() {
        return signatures.hashCode();
    }

    @Override
    public String toString() {
        return "SignatureSet" + signatures.keySet();
    }
}

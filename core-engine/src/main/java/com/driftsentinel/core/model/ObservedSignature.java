package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Signature of one element as observed in the current code, supplied by an
 * external code-analysis collaborator.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ObservedSignature {

    private final String signature;
    private final String behaviorHash;
    private final String docHash;
    private final Integer lineNumber;

    /**
     * @param signature    observed declaration, or resolved version for dependencies
     * @param behaviorHash observed behaviour hash; may be {@code null}
     * @param docHash      documentation hash the code was last aligned with; may be
     *                     {@code null}
     * @param lineNumber   1-based declaration line; may be {@code null}
     */
    @JsonCreator
    public ObservedSignature(@JsonProperty("signature") String signature,
            @JsonProperty("behaviorHash") String behaviorHash,
            @JsonProperty("docHash") String docHash,
            @JsonProperty("lineNumber") Integer lineNumber) {
        this.signature = Objects.requireNonNull(signature, "Observed signature must not be null");
        this.behaviorHash = behaviorHash;
        this.docHash = docHash;
        this.lineNumber = lineNumber;
    }

    public static ObservedSignature of(String signature) {
        return new ObservedSignature(signature, null, null, null);
    }

    public String getSignature() {
        return signature;
    }

    public String getBehaviorHash() {
        return behaviorHash;
    }

    public String getDocHash() {
        return docHash;
    }

    public Integer getLineNumber() {
        return lineNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ObservedSignature that))
            return false;
        return signature.equals(that.signature)
                && Objects.equals(behaviorHash, that.behaviorHash)
                && Objects.equals(docHash, that.docHash)
                && Objects.equals(lineNumber, that.lineNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature, behaviorHash, docHash, lineNumber);
    }

    @Override
    public String toString() {
        return "ObservedSignature{'" + signature + "' line=" + lineNumber + '}';
    }
}

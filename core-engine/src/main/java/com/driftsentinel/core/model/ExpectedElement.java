package com.driftsentinel.core.model;

import java.util.Objects;

/**
 * One element a {@link Specification} expects the code to provide.
 *
 * <p>
 * Instances are immutable. Use the {@link Builder}; {@code id} and
 * {@code signature} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExpectedElement {

    /** Identifier used to look up the observed signature. */
    private final String id;

    private final ElementKind kind;

    /** Declared signature, or declared version for dependencies. */
    private final String signature;

    /** Expected behaviour hash; {@code null} when behaviour is not tracked. */
    private final String behaviorHash;

    /** Hash of the element's documentation at the current spec revision. */
    private final String docHash;

    /** Public element whose removal or change breaks callers. */
    private final boolean breakingIfRemoved;

    /** Element that has already shipped as part of a stable API. */
    private final boolean stable;

    private ExpectedElement(Builder builder) {
        this.id = requireNonBlank(builder.id, "Element id");
        this.kind = builder.kind != null ? builder.kind : ElementKind.SYMBOL;
        this.signature = Objects.requireNonNull(builder.signature,
                "Signature must not be null for element '" + id + "'");
        this.behaviorHash = builder.behaviorHash;
        this.docHash = builder.docHash;
        this.breakingIfRemoved = builder.breakingIfRemoved;
        this.stable = builder.stable;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a public, breaking-if-removed symbol.
     *
     * @param id        element identifier
     * @param signature declared signature
     * @return a new element
     */
    public static ExpectedElement publicSymbol(String id, String signature) {
        return builder().id(id).signature(signature).breakingIfRemoved(true).build();
    }

    /**
     * Fluent builder for {@link ExpectedElement}.
     */
    public static class Builder {
        private String id;
        private ElementKind kind;
        private String signature;
        private String behaviorHash;
        private String docHash;
        private boolean breakingIfRemoved;
        private boolean stable;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(ElementKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder signature(String signature) {
            this.signature = signature;
            return this;
        }

        public Builder behaviorHash(String behaviorHash) {
            this.behaviorHash = behaviorHash;
            return this;
        }

        public Builder docHash(String docHash) {
            this.docHash = docHash;
            return this;
        }

        public Builder breakingIfRemoved(boolean breakingIfRemoved) {
            this.breakingIfRemoved = breakingIfRemoved;
            return this;
        }

        public Builder stable(boolean stable) {
            this.stable = stable;
            return this;
        }

        public ExpectedElement build() {
            return new ExpectedElement(this);
        }
    }

    public String getId() {
        return id;
    }

    public ElementKind getKind() {
        return kind;
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

    public boolean isBreakingIfRemoved() {
        return breakingIfRemoved;
    }

    public boolean isStable() {
        return stable;
    }

    /**
     * @return {@code true} for a stable public element whose change is an API break
     */
    public boolean isStablePublicApi() {
        return stable && breakingIfRemoved;
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExpectedElement that))
            return false;
        return breakingIfRemoved == that.breakingIfRemoved
                && stable == that.stable
                && id.equals(that.id)
                && kind == that.kind
                && signature.equals(that.signature)
                && Objects.equals(behaviorHash, that.behaviorHash)
                && Objects.equals(docHash, that.docHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, signature, behaviorHash, docHash, breakingIfRemoved, stable);
    }

    @Override
    public String toString() {
        return "ExpectedElement{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", signature='" + signature + '\'' +
                ", breakingIfRemoved=" + breakingIfRemoved +
                ", stable=" + stable +
                '}';
    }
}

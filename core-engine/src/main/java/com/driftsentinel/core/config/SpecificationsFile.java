package com.driftsentinel.core.config;

import com.driftsentinel.core.model.ElementKind;
import com.driftsentinel.core.model.ExpectedElement;
import com.driftsentinel.core.model.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * YAML shape of {@code specifications.yml}, the normalized output of the
 * external specification loaders.
 *
 * <pre>
 * specifications:
 *   - name: payments-api
 *     sourceRef: docs/openapi.yaml
 *     revision: "7"
 *     paths: [src/payments/**]
 *     elements:
 *       - id: charge
 *         signature: charge(account, amount)
 *         breakingIfRemoved: true
 *         stable: true
 * </pre>
 *
 * @since 1.0.0
 */
public class SpecificationsFile {

    private List<Entry> specifications = new ArrayList<>();

    public List<Entry> getSpecifications() {
        return specifications;
    }

    public void setSpecifications(List<Entry> specifications) {
        this.specifications = specifications != null ? specifications : new ArrayList<>();
    }

    /** One specification and the project paths (exact or glob) it governs. */
    public static class Entry {
        private String name;
        private String sourceRef;
        private String revision;
        private List<String> paths = new ArrayList<>();
        private List<Element> elements = new ArrayList<>();

        public Specification toSpecification() {
            List<ExpectedElement> expected = new ArrayList<>(elements.size());
            for (Element element : elements) {
                expected.add(element.toExpectedElement());
            }
            return new Specification(name, sourceRef, revision, expected);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSourceRef() {
            return sourceRef;
        }

        public void setSourceRef(String sourceRef) {
            this.sourceRef = sourceRef;
        }

        public String getRevision() {
            return revision;
        }

        public void setRevision(String revision) {
            this.revision = revision;
        }

        public List<String> getPaths() {
            return paths;
        }

        public void setPaths(List<String> paths) {
            this.paths = paths != null ? paths : new ArrayList<>();
        }

        public List<Element> getElements() {
            return elements;
        }

        public void setElements(List<Element> elements) {
            this.elements = elements != null ? elements : new ArrayList<>();
        }
    }

    /** One expected symbol or dependency. */
    public static class Element {
        private String id;
        private String kind = "symbol";
        private String signature;
        private String behaviorHash;
        private String docHash;
        private boolean breakingIfRemoved;
        private boolean stable;

        public ExpectedElement toExpectedElement() {
            return ExpectedElement.builder()
                    .id(id)
                    .kind(ElementKind.valueOf(kind.trim().toUpperCase(Locale.ROOT)))
                    .signature(signature)
                    .behaviorHash(behaviorHash)
                    .docHash(docHash)
                    .breakingIfRemoved(breakingIfRemoved)
                    .stable(stable)
                    .build();
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public String getSignature() {
            return signature;
        }

        public void setSignature(String signature) {
            this.signature = signature;
        }

        public String getBehaviorHash() {
            return behaviorHash;
        }

        public void setBehaviorHash(String behaviorHash) {
            this.behaviorHash = behaviorHash;
        }

        public String getDocHash() {
            return docHash;
        }

        public void setDocHash(String docHash) {
            this.docHash = docHash;
        }

        public boolean isBreakingIfRemoved() {
            return breakingIfRemoved;
        }

        public void setBreakingIfRemoved(boolean breakingIfRemoved) {
            this.breakingIfRemoved = breakingIfRemoved;
        }

        public boolean isStable() {
            return stable;
        }

        public void setStable(boolean stable) {
            this.stable = stable;
        }
    }
}

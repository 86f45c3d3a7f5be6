package com.driftsentinel.core.detection;

import com.driftsentinel.core.config.DetectionSettings;
import com.driftsentinel.core.model.DriftItem;
import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.core.model.DriftSeverity;
import com.driftsentinel.core.model.DriftType;
import com.driftsentinel.core.model.ElementKind;
import com.driftsentinel.core.model.ExpectedElement;
import com.driftsentinel.core.model.ObservedSignature;
import com.driftsentinel.core.model.SignatureSet;
import com.driftsentinel.core.model.Specification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies the deviation between a file's observed signatures and the
 * specification governing it.
 *
 * <h3>Classification</h3>
 * <ul>
 * <li>missing symbol: {@code MISSING_IMPLEMENTATION} (HIGH), or
 * {@code API_BREAKING_CHANGE} (CRITICAL) for a stable public symbol</li>
 * <li>signature differs: {@code SIGNATURE_MISMATCH} (HIGH if public, else
 * MEDIUM), or {@code API_BREAKING_CHANGE} for a stable public symbol</li>
 * <li>behaviour hash differs: {@code BEHAVIOR_DEVIATION} (MEDIUM)</li>
 * <li>documentation hash differs with the code otherwise aligned:
 * {@code DOCUMENTATION_STALE} (LOW)</li>
 * <li>dependency missing or at another version: {@code DEPENDENCY_DRIFT}
 * (MEDIUM)</li>
 * </ul>
 *
 * <p>
 * Each item carries a confidence derived from the configured weight table.
 * Items below {@link DetectionSettings#getMinConfidence()} are dropped. The
 * detector is <strong>stateless</strong> and deterministic: identical inputs
 * always produce equal reports, and a single instance may be shared by scan
 * workers.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DriftDetector.class);

    /** Confidence factor applied when only the signature text, not its arity, differs. */
    static final double TEXTUAL_MISMATCH_FACTOR = 0.85;

    private final DetectionSettings settings;

    public DriftDetector() {
        this(DetectionSettings.defaults());
    }

    public DriftDetector(DetectionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "DetectionSettings must not be null");
    }

    /**
     * Check one file.
     *
     * @param filePath          project-relative path of the file
     * @param currentSignatures signatures observed in the file now
     * @param specification     specification for the path; {@code null} if none
     *                          is loaded
     * @return the drift report; an item-less report with an INFO note when no
     *         specification applies
     */
    public DriftReport check(String filePath, SignatureSet currentSignatures, Specification specification) {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(currentSignatures, "currentSignatures must not be null");

        if (specification == null) {
            LOG.debug("No specification loaded for {} - nothing to check", filePath);
            return DriftReport.unspecified(filePath, "No specification loaded for " + filePath);
        }

        List<DriftItem> items = new ArrayList<>();
        int dropped = 0;
        for (ExpectedElement element : specification.getElements()) {
            Optional<ObservedSignature> observed = currentSignatures.get(element.getId());
            Optional<DriftItem> item = element.getKind() == ElementKind.DEPENDENCY
                    ? checkDependency(element, observed)
                    : checkSymbol(element, observed);
            if (item.isEmpty()) {
                continue;
            }
            DriftItem drift = item.get();
            if (drift.getConfidence() < settings.getMinConfidence()) {
                LOG.trace("{}: dropping {} for '{}' (confidence {} < {})", filePath, drift.getDriftType(),
                        drift.getElementId(), drift.getConfidence(), settings.getMinConfidence());
                dropped++;
                continue;
            }
            LOG.trace("{}: {} {} for '{}'", filePath, drift.getSeverity(), drift.getDriftType(), drift.getElementId());
            items.add(drift);
        }

        if (!items.isEmpty() || dropped > 0) {
            LOG.debug("Checked {} against {}: {} drift item(s), {} below confidence threshold",
                    filePath, specification.reference(), items.size(), dropped);
        }
        return new DriftReport(filePath, specification.reference(), items);
    }

    // ---------------------------------------------------------------
    // Symbols
    // ---------------------------------------------------------------

    private Optional<DriftItem> checkSymbol(ExpectedElement element, Optional<ObservedSignature> observed) {
        if (observed.isEmpty()) {
            if (element.isStablePublicApi()) {
                return Optional.of(item(DriftType.API_BREAKING_CHANGE, DriftSeverity.CRITICAL, element)
                        .description("Stable public API '" + element.getId() + "' was removed")
                        .confidence(weight(DriftType.API_BREAKING_CHANGE))
                        .build());
            }
            return Optional.of(item(DriftType.MISSING_IMPLEMENTATION, DriftSeverity.HIGH, element)
                    .description("'" + element.getId() + "' is specified but not implemented")
                    .confidence(weight(DriftType.MISSING_IMPLEMENTATION))
                    .build());
        }

        ObservedSignature actual = observed.get();
        String actualSignature = actual.getSignature() != null ? actual.getSignature() : "";
        SignatureComparator.Result comparison = SignatureComparator.compare(element.getSignature(), actualSignature);

        if (comparison != SignatureComparator.Result.MATCH) {
            double factor = comparison == SignatureComparator.Result.ARITY_MISMATCH ? 1.0 : TEXTUAL_MISMATCH_FACTOR;
            if (element.isStablePublicApi()) {
                return Optional.of(item(DriftType.API_BREAKING_CHANGE, DriftSeverity.CRITICAL, element)
                        .description("Incompatible change to stable public API '" + element.getId() + "'")
                        .confidence(weight(DriftType.API_BREAKING_CHANGE) * factor)
                        .actual(actualSignature)
                        .lineNumber(actual.getLineNumber())
                        .build());
            }
            DriftSeverity severity = element.isBreakingIfRemoved() ? DriftSeverity.HIGH : DriftSeverity.MEDIUM;
            String what = comparison == SignatureComparator.Result.ARITY_MISMATCH
                    ? "parameter count differs" : "signature differs";
            return Optional.of(item(DriftType.SIGNATURE_MISMATCH, severity, element)
                    .description("'" + element.getId() + "' " + what + " from specification")
                    .confidence(weight(DriftType.SIGNATURE_MISMATCH) * factor)
                    .actual(actualSignature)
                    .lineNumber(actual.getLineNumber())
                    .build());
        }

        if (element.getBehaviorHash() != null && actual.getBehaviorHash() != null
                && !element.getBehaviorHash().equals(actual.getBehaviorHash())) {
            return Optional.of(item(DriftType.BEHAVIOR_DEVIATION, DriftSeverity.MEDIUM, element)
                    .description("Behaviour of '" + element.getId() + "' deviates from the specified baseline")
                    .confidence(weight(DriftType.BEHAVIOR_DEVIATION))
                    .expected(element.getBehaviorHash())
                    .actual(actual.getBehaviorHash())
                    .lineNumber(actual.getLineNumber())
                    .build());
        }

        if (element.getDocHash() != null && !element.getDocHash().equals(actual.getDocHash())) {
            return Optional.of(item(DriftType.DOCUMENTATION_STALE, DriftSeverity.LOW, element)
                    .description("Specification for '" + element.getId()
                            + "' changed since the code was last aligned with it")
                    .confidence(weight(DriftType.DOCUMENTATION_STALE))
                    .expected(element.getDocHash())
                    .actual(actual.getDocHash())
                    .lineNumber(actual.getLineNumber())
                    .build());
        }

        return Optional.empty();
    }

    // ---------------------------------------------------------------
    // Dependencies
    // ---------------------------------------------------------------

    private Optional<DriftItem> checkDependency(ExpectedElement element, Optional<ObservedSignature> observed) {
        if (observed.isEmpty()) {
            return Optional.of(item(DriftType.DEPENDENCY_DRIFT, DriftSeverity.MEDIUM, element)
                    .description("Declared dependency '" + element.getId() + "' " + element.getSignature()
                            + " is not present")
                    .confidence(weight(DriftType.DEPENDENCY_DRIFT))
                    .build());
        }
        String version = observed.get().getSignature();
        if (version == null || !element.getSignature().trim().equals(version.trim())) {
            return Optional.of(item(DriftType.DEPENDENCY_DRIFT, DriftSeverity.MEDIUM, element)
                    .description("Dependency '" + element.getId() + "' is at " + version
                            + ", specification declares " + element.getSignature())
                    .confidence(weight(DriftType.DEPENDENCY_DRIFT))
                    .actual(version)
                    .lineNumber(observed.get().getLineNumber())
                    .build());
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DriftItem.Builder item(DriftType type, DriftSeverity severity, ExpectedElement element) {
        return DriftItem.builder()
                .driftType(type)
                .severity(severity)
                .elementId(element.getId())
                .expected(element.getSignature());
    }

    private double weight(DriftType type) {
        return settings.weightFor(type);
    }

    public DetectionSettings getSettings() {
        return settings;
    }
}

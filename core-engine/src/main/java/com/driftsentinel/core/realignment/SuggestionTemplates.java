package com.driftsentinel.core.realignment;

import com.driftsentinel.core.detection.SignatureComparator;
import com.driftsentinel.core.model.DriftItem;
import com.driftsentinel.core.model.DriftType;
import com.driftsentinel.core.model.Suggestion;
import com.driftsentinel.core.model.SuggestionCategory;
import com.driftsentinel.core.model.SuggestionSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic rule-based suggestions, one template per drift type.
 *
 * <p>
 * Priority follows the item severity (CRITICAL 5 down to LOW 2). Effort is the
 * template's base effort plus one for an expected signature with more than 3
 * parameters and one more above 6, clamped to 1..5.
 * </p>
 *
 * @since 1.0.0
 */
final class SuggestionTemplates {

    private static final Map<DriftType, Template> TEMPLATES;

    static {
        Map<DriftType, Template> t = new EnumMap<>(DriftType.class);
        t.put(DriftType.MISSING_IMPLEMENTATION, new Template(SuggestionCategory.CODE_CHANGE, 3,
                "Implement %s", true, List.of(
                        "Add %s with the specified signature",
                        "Cover the new element with tests",
                        "Re-run the drift scan to confirm")));
        t.put(DriftType.SIGNATURE_MISMATCH, new Template(SuggestionCategory.CODE_CHANGE, 2,
                "Align signature of %s", true, List.of(
                        "Change %s to match the specified signature",
                        "Update all call sites",
                        "Run the affected tests")));
        t.put(DriftType.BEHAVIOR_DEVIATION, new Template(SuggestionCategory.REFACTORING, 3,
                "Restore specified behaviour of %s", false, List.of(
                        "Compare the current behaviour of %s with the specification",
                        "Refactor the implementation back to the specified behaviour",
                        "Add a regression test for the specified behaviour")));
        t.put(DriftType.DOCUMENTATION_STALE, new Template(SuggestionCategory.DOCUMENTATION_UPDATE, 1,
                "Review specification change for %s", false, List.of(
                        "Read the updated specification section for %s",
                        "Adapt code or inline documentation where they differ",
                        "Record the reviewed specification revision")));
        t.put(DriftType.DEPENDENCY_DRIFT, new Template(SuggestionCategory.DEPENDENCY_UPDATE, 2,
                "Update dependency %s", false, List.of(
                        "Set %s to the declared version",
                        "Rebuild and run the full test suite")));
        t.put(DriftType.API_BREAKING_CHANGE, new Template(SuggestionCategory.API_UPDATE, 4,
                "Restore compatibility of %s", true, List.of(
                        "Reinstate %s with its released signature",
                        "Deprecate instead of removing if a change is required",
                        "Announce the change to API consumers")));
        TEMPLATES = Collections.unmodifiableMap(t);
    }

    private SuggestionTemplates() {
    }

    /**
     * @param item     drift item
     * @param filePath file the item was found in
     * @return one or more suggestions for the item
     */
    static List<Suggestion> forItem(DriftItem item, String filePath) {
        Template template = TEMPLATES.get(item.getDriftType());
        String id = item.getElementId();
        int priority = item.getSeverity().toPriority();
        int effort = clamp(template.baseEffort + sizeAdjustment(item.getExpected()));

        List<Suggestion> suggestions = new ArrayList<>(2);
        suggestions.add(Suggestion.builder()
                .category(template.category)
                .title(String.format(template.title, id))
                .description(item.getDescription())
                .priority(priority)
                .effort(effort)
                .confidence(item.getConfidence())
                .filePath(filePath)
                .lineNumber(item.getLineNumber())
                .codeSnippet(template.snippet ? item.getExpected() : null)
                .steps(template.steps(id))
                .source(SuggestionSource.RULE)
                .driftType(item.getDriftType())
                .build());

        if (item.getDriftType() == DriftType.SIGNATURE_MISMATCH) {
            suggestions.add(Suggestion.builder()
                    .category(SuggestionCategory.DOCUMENTATION_UPDATE)
                    .title("Update specification of " + id + " to the implemented signature")
                    .description("If the implemented signature " + item.getActual()
                            + " is intended, record it in the specification instead")
                    .priority(Math.max(1, priority - 1))
                    .effort(1)
                    .confidence(item.getConfidence())
                    .filePath(filePath)
                    .lineNumber(item.getLineNumber())
                    .steps(List.of("Change the specified signature of " + id + " to " + item.getActual(),
                            "Notify consumers of the specification"))
                    .source(SuggestionSource.RULE)
                    .driftType(item.getDriftType())
                    .build());
        }
        return suggestions;
    }

    /**
     * Suggestion for a file the monitor repeatedly failed to scan.
     */
    static Suggestion forScanFailure(String filePath, String error) {
        return Suggestion.builder()
                .category(SuggestionCategory.CONFIGURATION_CHANGE)
                .title("Investigate scan failure of " + filePath)
                .description(error != null ? error : "The file could not be analysed")
                .priority(3)
                .effort(2)
                .confidence(1.0)
                .filePath(filePath)
                .steps(List.of("Check that the signature extractor supports this file",
                        "Add the file to monitor.ignorePatterns if it should not be checked"))
                .build();
    }

    static int sizeAdjustment(String expectedSignature) {
        if (expectedSignature == null) {
            return 0;
        }
        int arity = SignatureComparator.arity(expectedSignature);
        int adjustment = 0;
        if (arity > 3) {
            adjustment++;
        }
        if (arity > 6) {
            adjustment++;
        }
        return adjustment;
    }

    private static int clamp(int effort) {
        return Math.max(1, Math.min(5, effort));
    }

    private static final class Template {
        private final SuggestionCategory category;
        private final int baseEffort;
        private final String title;
        private final boolean snippet;
        private final List<String> steps;

        private Template(SuggestionCategory category, int baseEffort, String title, boolean snippet,
                List<String> steps) {
            this.category = category;
            this.baseEffort = baseEffort;
            this.title = title;
            this.snippet = snippet;
            this.steps = steps;
        }

        private List<String> steps(String elementId) {
            List<String> formatted = new ArrayList<>(steps.size());
            for (String step : steps) {
                formatted.add(step.contains("%s") ? String.format(step, elementId) : step);
            }
            return formatted;
        }
    }
}

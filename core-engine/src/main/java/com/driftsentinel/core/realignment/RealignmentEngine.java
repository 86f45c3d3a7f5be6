package com.driftsentinel.core.realignment;

import com.driftsentinel.core.alerting.AlertEvent;
import com.driftsentinel.core.error.SuggestionGenerationException;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.AlertSeverity;
import com.driftsentinel.core.model.DriftItem;
import com.driftsentinel.core.model.DriftReport;
import com.driftsentinel.core.model.DriftSeverity;
import com.driftsentinel.core.model.Suggestion;
import com.driftsentinel.core.model.SuggestionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Maps drift reports to ranked, actionable suggestions.
 *
 * <p>
 * Rule-based templates always produce at least one suggestion per drift item.
 * An optional {@link SuggestionEnricher} may add more; it runs on a separate
 * thread with a timeout, and any failure leaves the rule-based list as the
 * result. Suggestions are ordered by descending priority, ties broken by
 * ascending effort.
 * </p>
 *
 * @since 1.0.0
 */
public class RealignmentEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RealignmentEngine.class);

    static final Comparator<Suggestion> RANKING = Comparator
            .comparingInt(Suggestion::getPriority).reversed()
            .thenComparingInt(Suggestion::getEffort);

    private final Duration enricherTimeout;
    private final ExecutorService executor;

    public RealignmentEngine() {
        this(Duration.ofSeconds(10));
    }

    public RealignmentEngine(Duration enricherTimeout) {
        this.enricherTimeout = Objects.requireNonNull(enricherTimeout, "Enricher timeout must not be null");
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "drift-suggestion-enricher");
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    public List<Suggestion> suggest(DriftReport report) {
        return suggest(report, null);
    }

    /**
     * @param report   drift report; must not be {@code null}
     * @param enricher optional enricher; may be {@code null}
     * @return ranked suggestions, never empty for a report with items
     */
    public List<Suggestion> suggest(DriftReport report, SuggestionEnricher enricher) {
        Objects.requireNonNull(report, "DriftReport must not be null");

        List<Suggestion> suggestions = new ArrayList<>();
        for (DriftItem item : report.getItems()) {
            suggestions.addAll(SuggestionTemplates.forItem(item, report.getFilePath()));
        }

        if (enricher != null && !report.isEmpty()) {
            try {
                suggestions = merge(suggestions, enrich(enricher, report));
            } catch (SuggestionGenerationException e) {
                LOG.warn("Suggestion enrichment failed for {}, using rule-based suggestions: {}",
                        report.getFilePath(), e.getMessage());
            }
        }

        suggestions.sort(RANKING);
        LOG.debug("Generated {} suggestion(s) for {} drift item(s) in {}",
                suggestions.size(), report.getItems().size(), report.getFilePath());
        return List.copyOf(suggestions);
    }

    public RealignmentPlan plan(DriftReport report, SuggestionEnricher enricher) {
        return new RealignmentPlan(report.getFilePath(), suggest(report, enricher));
    }

    /**
     * Suggestions for a stored alert, rebuilt from the drift details kept in
     * its context.
     *
     * @param alert    drift or scan-failure alert
     * @param enricher optional enricher; may be {@code null}
     * @return ranked suggestions, never empty
     */
    public List<Suggestion> suggestForAlert(Alert alert, SuggestionEnricher enricher) {
        Objects.requireNonNull(alert, "Alert must not be null");
        String filePath = alert.getFilePath() != null ? alert.getFilePath() : "";
        if (alert.getDriftType() == null) {
            return List.of(SuggestionTemplates.forScanFailure(filePath,
                    alert.getContext().get(AlertEvent.CTX_ERROR)));
        }
        return suggest(reportFromAlert(alert, filePath), enricher);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Suggestion> enrich(SuggestionEnricher enricher, DriftReport report) {
        Future<List<Suggestion>> future = executor.submit(() -> enricher.enrich(report));
        try {
            List<Suggestion> enriched = future.get(enricherTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return enriched != null ? enriched : List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SuggestionGenerationException("Enricher timed out after " + enricherTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SuggestionGenerationException sge) {
                throw sge;
            }
            throw new SuggestionGenerationException("Enricher failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new SuggestionGenerationException("Interrupted while waiting for enricher", e);
        }
    }

    /**
     * Adds enricher suggestions not already present by (category, file,
     * title). For duplicates the rule suggestion is kept with the enricher's
     * confidence.
     */
    static List<Suggestion> merge(List<Suggestion> rules, List<Suggestion> enriched) {
        Map<String, Suggestion> merged = new LinkedHashMap<>();
        for (Suggestion s : rules) {
            merged.put(key(s), s);
        }
        for (Suggestion s : enriched) {
            if (s == null) {
                continue;
            }
            String key = key(s);
            Suggestion existing = merged.get(key);
            if (existing != null) {
                merged.put(key, existing.toBuilder().confidence(s.getConfidence()).build());
            } else {
                merged.put(key, s.getSource() == SuggestionSource.AI
                        ? s
                        : s.toBuilder().source(SuggestionSource.AI).build());
            }
        }
        return new ArrayList<>(merged.values());
    }

    private static String key(Suggestion s) {
        return s.getCategory() + "|" + Objects.toString(s.getFilePath(), "") + "|" + s.getTitle();
    }

    private static DriftReport reportFromAlert(Alert alert, String filePath) {
        Map<String, String> ctx = alert.getContext();
        String elements = ctx.getOrDefault(AlertEvent.CTX_ELEMENTS, "");
        String elementId = elements.isBlank() ? alert.getId() : elements.split(",")[0];

        DriftItem item = DriftItem.builder()
                .driftType(alert.getDriftType())
                .severity(driftSeverity(ctx.get(AlertEvent.CTX_DRIFT_SEVERITY), alert.getSeverity()))
                .elementId(elementId)
                .description(ctx.getOrDefault(AlertEvent.CTX_DESCRIPTION,
                        alert.getMessage() != null ? alert.getMessage() : alert.getDriftType().name()))
                .confidence(parseConfidence(ctx.get(AlertEvent.CTX_CONFIDENCE)))
                .expected(ctx.get(AlertEvent.CTX_EXPECTED))
                .actual(ctx.get(AlertEvent.CTX_ACTUAL))
                .lineNumber(parseLine(ctx.get(AlertEvent.CTX_LINE)))
                .build();
        return new DriftReport(filePath, alert.getSpecReference(), List.of(item));
    }

    private static DriftSeverity driftSeverity(String name, AlertSeverity fallback) {
        if (name != null) {
            try {
                return DriftSeverity.valueOf(name);
            } catch (IllegalArgumentException e) {
                LOG.debug("Unknown drift severity '{}' in alert context", name);
            }
        }
        for (DriftSeverity severity : DriftSeverity.values()) {
            if (severity.toAlertSeverity() == fallback) {
                return severity;
            }
        }
        return DriftSeverity.MEDIUM;
    }

    private static double parseConfidence(String value) {
        if (value == null) {
            return 1.0;
        }
        try {
            double d = Double.parseDouble(value);
            return d >= 0 && d <= 1 ? d : 1.0;
        } catch (NumberFormatException e) {
            return 1.0;
        }
    }

    private static Integer parseLine(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

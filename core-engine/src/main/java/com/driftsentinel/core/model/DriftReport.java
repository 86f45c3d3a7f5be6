package com.driftsentinel.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable result of checking one file against its specification.
 *
 * <p>
 * A report is created fresh for every scan and never mutated afterwards; the
 * alerting pipeline and the realignment engine both consume the same snapshot.
 * Two reports built from identical inputs are {@link #equals(Object) equal}.
 * </p>
 *
 * <p>
 * Informational notes (for example "no specification loaded") are carried
 * separately from drift items and never raise alerts.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftReport {

    private final String filePath;
    private final String specReference;
    private final List<DriftItem> items;
    private final List<String> notes;

    public DriftReport(String filePath, String specReference, List<DriftItem> items, List<String> notes) {
        this.filePath = Objects.requireNonNull(filePath, "filePath must not be null");
        this.specReference = specReference;
        this.items = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(items, "items must not be null")));
        this.notes = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(notes, "notes must not be null")));
    }

    public DriftReport(String filePath, String specReference, List<DriftItem> items) {
        this(filePath, specReference, items, List.of());
    }

    /**
     * Empty report for a path that has no specification.
     *
     * @param filePath the scanned path
     * @param note     informational message explaining why nothing was checked
     * @return a report with no items and a single INFO note
     */
    public static DriftReport unspecified(String filePath, String note) {
        return new DriftReport(filePath, null, List.of(), List.of(note));
    }

    /**
     * @param types drift types to keep
     * @return a new report holding only items whose type is in {@code types}
     */
    public DriftReport retainTypes(Collection<DriftType> types) {
        Set<DriftType> keep = Set.copyOf(types);
        List<DriftItem> kept = items.stream()
                .filter(i -> keep.contains(i.getDriftType()))
                .toList();
        return kept.size() == items.size() ? this : new DriftReport(filePath, specReference, kept, notes);
    }

    public String getFilePath() {
        return filePath;
    }

    public String getSpecReference() {
        return specReference;
    }

    public List<DriftItem> getItems() {
        return items;
    }

    public List<String> getNotes() {
        return notes;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Optional<DriftSeverity> maxSeverity() {
        return items.stream().map(DriftItem::getSeverity).max(Comparator.naturalOrder());
    }

    public Map<DriftType, Integer> countByType() {
        Map<DriftType, Integer> counts = new EnumMap<>(DriftType.class);
        for (DriftItem item : items) {
            counts.merge(item.getDriftType(), 1, Integer::sum);
        }
        return counts;
    }

    public Map<DriftSeverity, Integer> countBySeverity() {
        Map<DriftSeverity, Integer> counts = new EnumMap<>(DriftSeverity.class);
        for (DriftItem item : items) {
            counts.merge(item.getSeverity(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DriftReport that))
            return false;
        return filePath.equals(that.filePath)
                && Objects.equals(specReference, that.specReference)
                && items.equals(that.items)
                && notes.equals(that.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePath, specReference, items, notes);
    }

    @Override
    public String toString() {
        return "DriftReport{" +
                "filePath='" + filePath + '\'' +
                ", specReference='" + specReference + '\'' +
                ", items=" + items +
                ", notes=" + notes +
                '}';
    }
}

package com.driftsentinel.core.realignment;

import com.driftsentinel.core.model.Suggestion;
import com.driftsentinel.core.model.SuggestionCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ranked suggestions for one file plus effort and distribution totals.
 *
 * @since 1.0.0
 */
public final class RealignmentPlan {

    private final String filePath;
    private final List<Suggestion> suggestions;
    private final int totalEffort;
    private final Map<SuggestionCategory, Integer> byCategory;
    private final Map<Integer, Integer> byPriority;

    RealignmentPlan(String filePath, List<Suggestion> suggestions) {
        this.filePath = filePath;
        this.suggestions = List.copyOf(suggestions);
        Map<SuggestionCategory, Integer> categories = new EnumMap<>(SuggestionCategory.class);
        Map<Integer, Integer> priorities = new TreeMap<>(Collections.reverseOrder());
        int effort = 0;
        for (Suggestion s : suggestions) {
            effort += s.getEffort();
            categories.merge(s.getCategory(), 1, Integer::sum);
            priorities.merge(s.getPriority(), 1, Integer::sum);
        }
        this.totalEffort = effort;
        this.byCategory = Collections.unmodifiableMap(categories);
        this.byPriority = Collections.unmodifiableMap(priorities);
    }

    public String getFilePath() {
        return filePath;
    }

    /**
     * @return suggestions, highest priority first
     */
    public List<Suggestion> getSuggestions() {
        return suggestions;
    }

    /**
     * @return sum of effort points over all suggestions
     */
    public int getTotalEffort() {
        return totalEffort;
    }

    public Map<SuggestionCategory, Integer> getByCategory() {
        return byCategory;
    }

    /**
     * @return suggestion count per priority, highest priority first
     */
    public Map<Integer, Integer> getByPriority() {
        return byPriority;
    }

    public boolean isEmpty() {
        return suggestions.isEmpty();
    }

    @Override
    public String toString() {
        return "RealignmentPlan{filePath='" + filePath + "', suggestions=" + suggestions.size()
                + ", totalEffort=" + totalEffort + ", byCategory=" + byCategory + '}';
    }
}

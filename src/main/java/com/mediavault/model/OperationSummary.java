package com.mediavault.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters and rejection list of one import, retag or terraform run.
 * Mutated only by the worker thread; published to the caller through the complete event.
 */
public class OperationSummary {
    private int processed;
    private int duplicates;
    private int errors;
    private int skipped;
    private boolean cancelled;
    private final Map<Disposition, Integer> categoryCounts = new EnumMap<>(Disposition.class);
    private final List<Rejection> rejections = new ArrayList<>();

    public void recordProcessed() {
        processed++;
    }

    /**
     * Counts a rejection under its category. Duplicates and RAW skips have their own counters,
     * every other category is an error.
     */
    public void recordRejection(Rejection rejection) {
        rejections.add(rejection);
        categoryCounts.merge(rejection.getCategory(), 1, Integer::sum);
        switch (rejection.getCategory()) {
            case DUPLICATE:
                duplicates++;
                break;
            case RAW_SKIPPED:
                skipped++;
                break;
            default:
                errors++;
        }
    }

    public void markCancelled() {
        cancelled = true;
    }

    @JsonProperty("processed")
    public int getProcessed() { return processed; }

    @JsonProperty("duplicates")
    public int getDuplicates() { return duplicates; }

    @JsonProperty("errors")
    public int getErrors() { return errors; }

    @JsonProperty("skipped")
    public int getSkipped() { return skipped; }

    @JsonProperty("cancelled")
    public boolean isCancelled() { return cancelled; }

    @JsonIgnore
    public int countOf(Disposition category) {
        return categoryCounts.getOrDefault(category, 0);
    }

    @JsonProperty("categories")
    public Map<String, Integer> getCategoryCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        categoryCounts.forEach((category, count) -> counts.put(category.wireName(), count));
        return counts;
    }

    @JsonProperty("rejections")
    public List<Rejection> getRejections() {
        return Collections.unmodifiableList(rejections);
    }

    @Override
    public String toString() {
        return "processed=" + processed + ", duplicates=" + duplicates + ", errors=" + errors + ", skipped=" + skipped
                + (cancelled ? ", cancelled" : "");
    }
}

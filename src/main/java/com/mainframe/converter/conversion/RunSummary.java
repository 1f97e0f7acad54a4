package com.mainframe.converter.conversion;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Aggregate of all per-file results of one run.
 */
@Value
@Builder
public class RunSummary {
    @Singular
    List<ConversionResult> results;

    public int getAttempted() {
        return results.size();
    }

    public int getSucceeded() {
        return (int) results.stream().filter(ConversionResult::isSuccess).count();
    }

    public int getFailed() {
        return getAttempted() - getSucceeded();
    }

    public boolean hasFailures() {
        return getFailed() > 0;
    }
}

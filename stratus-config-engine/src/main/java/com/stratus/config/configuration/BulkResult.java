package com.stratus.config.configuration;

import com.stratus.config.error.ConfigEngineException;
import com.stratus.config.error.ValidationException;
import com.stratus.config.error.Violation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a best-effort batch. Every item lands in exactly one of the two lists.
 *
 * @param <T> type of a successful item
 */
public class BulkResult<T> {

    private final List<T> succeeded = new ArrayList<>();
    private final List<ItemError> failed = new ArrayList<>();

    public void addSuccess(T item) {
        succeeded.add(item);
    }

    public void addFailure(String reference, ConfigEngineException error) {
        List<Violation> violations = error instanceof ValidationException validation
                ? validation.getViolations()
                : List.of();
        failed.add(new ItemError(reference, error.getCode(), error.getMessage(), violations));
    }

    /**
     * Append another batch's outcome to this one.
     */
    public void merge(BulkResult<T> other) {
        succeeded.addAll(other.succeeded);
        failed.addAll(other.failed);
    }

    public List<T> getSucceeded() {
        return Collections.unmodifiableList(succeeded);
    }

    public List<ItemError> getFailed() {
        return Collections.unmodifiableList(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    /**
     * A failed batch item.
     *
     * @param reference key or id identifying the item
     */
    public record ItemError(String reference, String code, String message, List<Violation> violations) {
    }
}

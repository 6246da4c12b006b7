package com.eyelevel.imageprocessor.model;

import java.util.Optional;

/**
 * Result of processing one item: either a value or the reason it failed.
 * A failed outcome never carries a value.
 */
public record ItemOutcome<T>(T value, String failureReason) {

    public static <T> ItemOutcome<T> success(T value) {
        return new ItemOutcome<>(value, null);
    }

    public static <T> ItemOutcome<T> failure(String reason) {
        return new ItemOutcome<>(null, reason == null || reason.isBlank() ? "unknown error" : reason);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }
}

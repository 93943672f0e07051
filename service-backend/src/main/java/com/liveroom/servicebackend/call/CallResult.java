package com.liveroom.servicebackend.call;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a call operation: either a value or a {@link CallError} with a message.
 */
public record CallResult<T>(boolean success, T value, CallError error, String message) {

    public static <T> CallResult<T> success(T value) {
        return new CallResult<>(true, value, null, null);
    }

    public static <T> CallResult<T> failure(CallError error, String message) {
        Objects.requireNonNull(error, "error must not be null");
        return new CallResult<>(false, null, error, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public <R> CallResult<R> map(Function<? super T, ? extends R> mapper) {
        return success ? success(mapper.apply(value)) : failure(error, message);
    }

    /**
     * Re-types a failure; must not be called on a success.
     */
    public <R> CallResult<R> asFailure() {
        if (success) {
            throw new IllegalStateException("Result is a success");
        }
        return failure(error, message);
    }
}

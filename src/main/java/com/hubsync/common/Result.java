package com.hubsync.common;

import lombok.EqualsAndHashCode;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Success-with-value or failure-with-cause. Returned across component boundaries so that only the
 * outermost loop decides whether a failure means "retry".
 *
 * @param <T> the type of value returned on success
 */
@EqualsAndHashCode
public final class Result<T> {

    private final boolean success;
    private final T value;
    private final String errorMessage;
    private final Throwable cause;

    private Result(boolean success, T value, String errorMessage, Throwable cause) {
        this.success = success;
        this.value = value;
        this.errorMessage = errorMessage;
        this.cause = cause;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(true, value, null, null);
    }

    public static <T> Result<T> failure(String errorMessage) {
        return new Result<>(false, null, Objects.requireNonNull(errorMessage, "errorMessage"), null);
    }

    public static <T> Result<T> failure(String errorMessage, Throwable cause) {
        return new Result<>(false, null, Objects.requireNonNull(errorMessage, "errorMessage"), cause);
    }

    /**
     * Runs the supplier and captures any runtime exception as a failure.
     */
    public static <T> Result<T> of(Supplier<T> supplier) {
        try {
            return success(supplier.get());
        } catch (RuntimeException e) {
            return failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<T> getValue() {
        return success ? Optional.ofNullable(value) : Optional.empty();
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public <U> Result<U> map(Function<T, U> mapper) {
        if (success) {
            return Result.success(mapper.apply(value));
        }
        return new Result<>(false, null, errorMessage, cause);
    }

    /**
     * Returns the value, or throws the captured cause (wrapped when checked) if this is a failure.
     */
    public T orElseThrow() {
        if (success) {
            return value;
        }
        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        throw new IllegalStateException(errorMessage, cause);
    }

    @Override
    public String toString() {
        return success ? "Result.success(" + value + ")" : "Result.failure(" + errorMessage + ")";
    }
}

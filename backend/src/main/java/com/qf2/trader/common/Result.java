package com.qf2.trader.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a call across an external boundary: either a value or an error kind with a message.
 * Business-rule blocks are not expressed as results.
 */
public final class Result<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String error;

    private Result(T value, ErrorKind errorKind, String error) {
        this.value = value;
        this.errorKind = errorKind;
        this.error = error;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> Result<T> err(ErrorKind kind, String message) {
        return new Result<>(null, Objects.requireNonNull(kind, "kind"), message);
    }

    public boolean isOk() {
        return errorKind == null;
    }

    public T get() {
        if (!isOk()) {
            throw new IllegalStateException("Result is an error: " + errorKind + " " + error);
        }
        return value;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    public String error() {
        return error;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (!isOk()) {
            return new Result<>(null, errorKind, error);
        }
        return Result.ok(mapper.apply(value));
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + errorKind + ": " + error + ")";
    }
}

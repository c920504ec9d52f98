package com.vaultengine.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value (ok) or an error (err). Used where a failure is an expected outcome rather than a fault,
 * so callers branch on {@link #isOk()} instead of catching.
 *
 * @param <T> success value type; may be null (e.g. {@code Result<Void, E>})
 * @param <E> error type; never null
 */
public final class Result<T, E> {

    private final T value;
    private final E error;

    private Result(T value, E error) {
        this.value = value;
        this.error = error;
    }

    public static <T, E> Result<T, E> ok(T value) {
        return new Result<>(value, null);
    }

    public static <T, E> Result<T, E> err(E error) {
        return new Result<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isErr() {
        return error != null;
    }

    /**
     * @throws IllegalStateException if this is an error
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Result is an error: " + error);
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this is ok
     */
    public E getError() {
        if (error == null) {
            throw new IllegalStateException("Result is ok, no error present");
        }
        return error;
    }

    public Optional<T> toOptional() {
        return isOk() ? Optional.ofNullable(value) : Optional.empty();
    }

    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        return isOk() ? ok(mapper.apply(value)) : err(error);
    }

    public <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        return isOk() ? mapper.apply(value) : err(error);
    }

    /**
     * Re-types an error result; only legal on errors.
     */
    public <U> Result<U, E> castError() {
        return err(getError());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Result<?, ?> other = (Result<?, ?>) o;
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}

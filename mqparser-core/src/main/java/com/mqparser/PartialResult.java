package com.mqparser;

/**
 * Outcome that distinguishes a clean failure from one that still produced something useful.
 *
 * @param <T> success value
 * @param <P> partial value
 * @param <E> error
 */
public sealed interface PartialResult<T, P, E> {

    record Ok<T, P, E>(T value) implements PartialResult<T, P, E> {
    }

    record Partial<T, P, E>(P partial, E error) implements PartialResult<T, P, E> {
    }

    record Err<T, P, E>(E error) implements PartialResult<T, P, E> {
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isPartial() {
        return this instanceof Partial;
    }

    default boolean isErr() {
        return this instanceof Err;
    }
}

package com.jclean.session;

import com.jclean.common.ErrorKind;

import java.util.Objects;

/**
 * Outcome of a dispatched command: a payload on success, an error kind and
 * message on failure.
 *
 * @param <T> Payload type
 */
public final class CommandResult<T> {
    private final T payload;
    private final ErrorKind errorKind;
    private final String message;

    private CommandResult(T payload, ErrorKind errorKind, String message) {
        this.payload = payload;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static <T> CommandResult<T> success(T payload) {
        return new CommandResult<>(payload, null, null);
    }

    public static <T> CommandResult<T> failure(ErrorKind kind, String message) {
        return new CommandResult<>(null, Objects.requireNonNull(kind, "kind cannot be null"), message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    /**
     * The success payload.
     *
     * @throws IllegalStateException if this result is a failure
     */
    public T getPayload() {
        if (!isSuccess()) {
            throw new IllegalStateException("Command failed with " + errorKind + ": " + message);
        }
        return payload;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success{" + payload + "}" : "Failure{" + errorKind + ": " + message + "}";
    }
}

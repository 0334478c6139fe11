package com.demo.groupchat.exception;

import lombok.Getter;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Domain failure carrying an {@link ErrorCode}.
 *
 * Thrown synchronously by validation, and used to complete futures exceptionally
 * for failures detected after I/O.
 */
@Getter
public class ChatServiceException extends RuntimeException {

    private final ErrorCode code;

    public ChatServiceException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ChatServiceException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static ChatServiceException invalidArgument(String message) {
        return new ChatServiceException(ErrorCode.INVALID_ARGUMENT, message);
    }

    public static ChatServiceException notFound(String message) {
        return new ChatServiceException(ErrorCode.NOT_FOUND, message);
    }

    public static ChatServiceException alreadyExists(String message) {
        return new ChatServiceException(ErrorCode.ALREADY_EXISTS, message);
    }

    public static ChatServiceException upstream(String message, Throwable cause) {
        return new ChatServiceException(ErrorCode.UPSTREAM, message, cause);
    }

    /**
     * Strip the wrappers added by {@code CompletableFuture} so callers see the original failure.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * True when the (possibly wrapped) failure is a domain failure with the given code.
     */
    public static boolean hasCode(Throwable error, ErrorCode code) {
        return unwrap(error) instanceof ChatServiceException ex && ex.getCode() == code;
    }
}

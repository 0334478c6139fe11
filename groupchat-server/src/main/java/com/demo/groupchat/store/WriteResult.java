package com.demo.groupchat.store;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class WriteResult<T> {

    private final Status status;
    private final T document;

    public enum Status {
        SUCCESS,
        CONDITION_FAILED,
        NOT_FOUND
    }

    public static <T> WriteResult<T> success(T document) {
        return new WriteResult<>(Status.SUCCESS, document);
    }

    public static <T> WriteResult<T> conditionFailed() {
        return new WriteResult<>(Status.CONDITION_FAILED, null);
    }

    public static <T> WriteResult<T> notFound() {
        return new WriteResult<>(Status.NOT_FOUND, null);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Optional<T> document() {
        return Optional.ofNullable(document);
    }
}

package com.demo.groupchat.exception;

/**
 * Failure kinds surfaced by the chat domain operations.
 */
public enum ErrorCode {
    INVALID_ARGUMENT,
    NOT_FOUND,
    ALREADY_EXISTS,
    ALREADY_MEMBER,
    NOT_MEMBER,
    INVALID_SENDER,
    NOT_A_MEMBER,
    MISSING_TOKEN,
    UPSTREAM,
    UNAUTHENTICATED
}

package io.agentmail.error;

public enum ErrorKind {
    VALIDATION,
    CONFLICT,
    DELIVERY_DENIED,
    LINK_BLOCKED,
    ILLEGAL_TRANSITION,
    NOT_FOUND,
    NOT_OWNER,
    NOT_RECIPIENT,
    UNKNOWN_AGENT
}

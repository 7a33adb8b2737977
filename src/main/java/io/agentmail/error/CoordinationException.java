package io.agentmail.error;

import java.util.Map;

/**
 * Caller-facing failure of a coordination operation.
 *
 * <p>Every failure carries an {@link ErrorKind} so callers can tell malformed input apart from
 * policy denials and ownership errors. The transaction that raised it has already been rolled
 * back when the exception reaches the caller.
 */
public class CoordinationException extends RuntimeException {
    private final ErrorKind kind;
    private final Map<String, Object> details;

    public CoordinationException(ErrorKind kind, String message) {
        this(kind, message, Map.of());
    }

    public CoordinationException(ErrorKind kind, String message, Map<String, Object> details) {
        super(message);
        this.kind = kind;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ErrorKind kind() {
        return kind;
    }

    public Map<String, Object> details() {
        return details;
    }

    public static CoordinationException validation(String message) {
        return new CoordinationException(ErrorKind.VALIDATION, message);
    }

    public static CoordinationException notFound(String what, Object id) {
        return new CoordinationException(ErrorKind.NOT_FOUND, what + " not found: " + id, Map.of("id", String.valueOf(id)));
    }

    public static CoordinationException unknownAgent(Object ref) {
        return new CoordinationException(ErrorKind.UNKNOWN_AGENT, "Unknown agent: " + ref, Map.of("agent", String.valueOf(ref)));
    }

    public static CoordinationException inactiveAgent(Object ref) {
        return new CoordinationException(ErrorKind.UNKNOWN_AGENT, "Agent is deregistered: " + ref, Map.of("agent", String.valueOf(ref)));
    }

    public static CoordinationException conflict(String message) {
        return new CoordinationException(ErrorKind.CONFLICT, message);
    }

    public static CoordinationException illegalTransition(String entity, Object from, Object to) {
        return new CoordinationException(
                ErrorKind.ILLEGAL_TRANSITION,
                entity + " cannot move from " + from + " to " + to,
                Map.of("from", String.valueOf(from), "to", String.valueOf(to))
        );
    }
}

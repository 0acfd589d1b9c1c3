package com.distributed26.adaptivestream.shared.errors;

import java.util.Objects;

public class TranscodeException extends PipelineException {
    public enum Kind {
        /** Process crash, resource exhaustion, timeout. Retried with backoff. */
        TRANSIENT,
        /** Unsupported encoder, empty output. Fails the rendition immediately. */
        PERMANENT
    }

    private final Kind kind;

    public TranscodeException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is null");
    }

    public TranscodeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind is null");
    }

    public static TranscodeException transientFailure(String message, Throwable cause) {
        return new TranscodeException(Kind.TRANSIENT, message, cause);
    }

    public static TranscodeException permanentFailure(String message) {
        return new TranscodeException(Kind.PERMANENT, message);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    @Override
    public String describe() {
        return "TranscodeException{" + kind.name().toLowerCase() + "}: " + getMessage();
    }
}

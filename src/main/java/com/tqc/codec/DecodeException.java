package com.tqc.codec;

import java.io.IOException;

/**
 * Raised when a response frame cannot be decoded. The stream position is unknown
 * afterwards, so the connection the decoder reads from must be closed.
 */
public class DecodeException extends IOException {

    public enum Reason {
        SHORT_HEADER,
        TOKEN_MISMATCH,
        SHORT_LIST_SIZE,
        INVALID_LIST_SIZE,
        SHORT_CHUNK_LENGTH,
        INVALID_CHUNK_LENGTH,
        SHORT_CHUNK_BODY
    }

    private final Reason reason;

    public DecodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}

package com.sentinelplatform.common.exception;

import com.sentinelplatform.common.model.ErrorKind;

/**
 * Root of the platform's unchecked failure hierarchy. Each subclass maps to exactly one
 * {@link ErrorKind}, which is what ends up on a failed activity record.
 */
public abstract class SentinelException extends RuntimeException {

    protected SentinelException(String message) {
        super(message);
    }

    protected SentinelException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}

package com.sentinelplatform.common.exception;

import com.sentinelplatform.common.model.ErrorKind;

public class PersistenceFailedException extends SentinelException {

    public PersistenceFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNEXPECTED;
    }
}

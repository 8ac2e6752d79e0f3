package com.sentinelplatform.common.exception;

import com.sentinelplatform.common.model.ErrorKind;

/** Notification delivery failed. Always logged and swallowed at the publishing boundary. */
public class NotifierFailedException extends SentinelException {

    public NotifierFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNEXPECTED;
    }
}

package com.sentinelplatform.common.exception;

import com.sentinelplatform.common.model.ErrorKind;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;

public class UnsupportedTokenException extends SentinelException {

    public UnsupportedTokenException(PaymentToken token, NetworkType network) {
        super(token + " is not available on " + network.wireValue());
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNSUPPORTED_TOKEN;
    }
}

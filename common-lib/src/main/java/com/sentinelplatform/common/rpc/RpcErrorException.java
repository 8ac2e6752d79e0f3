package com.sentinelplatform.common.rpc;

import com.sentinelplatform.common.exception.NetworkUnavailableException;

/** The node answered, but with a JSON-RPC {@code error} object. */
public class RpcErrorException extends NetworkUnavailableException {

    private final int code;

    public RpcErrorException(String method, int code, String message) {
        super("RPC " + method + " failed: code=" + code + " message=" + message, null);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}

package com.sentinelplatform.common.exception;

import com.sentinelplatform.common.model.ErrorKind;
import com.sentinelplatform.common.model.PaymentToken;

import java.math.BigDecimal;

public class InsufficientFundsException extends SentinelException {

    private final PaymentToken token;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientFundsException(PaymentToken token, BigDecimal required, BigDecimal available) {
        super("Insufficient " + token + " balance: required=" + required.toPlainString()
              + " available=" + available.toPlainString());
        this.token     = token;
        this.required  = required;
        this.available = available;
    }

    public PaymentToken getToken()     { return token; }
    public BigDecimal getRequired()    { return required; }
    public BigDecimal getAvailable()   { return available; }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INSUFFICIENT_FUNDS;
    }
}

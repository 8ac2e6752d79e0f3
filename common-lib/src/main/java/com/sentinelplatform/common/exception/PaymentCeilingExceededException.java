package com.sentinelplatform.common.exception;

import com.sentinelplatform.common.model.ErrorKind;
import com.sentinelplatform.common.model.NetworkType;

import java.math.BigDecimal;

public class PaymentCeilingExceededException extends SentinelException {

    private final BigDecimal amount;
    private final BigDecimal ceiling;

    public PaymentCeilingExceededException(NetworkType network, BigDecimal amount, BigDecimal ceiling) {
        super("Payment " + amount.toPlainString() + " exceeds single-payment ceiling "
              + ceiling.toPlainString() + " on " + network.wireValue());
        this.amount  = amount;
        this.ceiling = ceiling;
    }

    public BigDecimal getAmount()  { return amount; }
    public BigDecimal getCeiling() { return ceiling; }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PAYMENT_CEILING_EXCEEDED;
    }
}

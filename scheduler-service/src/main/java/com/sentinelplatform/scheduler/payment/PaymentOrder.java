package com.sentinelplatform.scheduler.payment;

import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;

import java.math.BigDecimal;

public record PaymentOrder(String fromWallet, String toAddress, BigDecimal amount,
                           PaymentToken token, NetworkType network) {}

package com.sentinelplatform.oracle.payment;

import com.sentinelplatform.common.protocol.PaymentProof;
import reactor.core.publisher.Mono;

/**
 * Decides whether a submitted proof pays for one check. A rejection is a normal result,
 * not an error; errors are reserved for the verifier being unable to answer at all.
 */
public interface PaymentVerifier {

    Mono<VerificationResult> verify(PaymentProof proof);
}

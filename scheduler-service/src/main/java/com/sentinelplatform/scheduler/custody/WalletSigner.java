package com.sentinelplatform.scheduler.custody;

import reactor.core.publisher.Mono;

/** Signs transfers for exactly one wallet. Key material never leaves the implementation. */
public interface WalletSigner {

    String walletAddress();

    /** @return the fully signed transaction, base64-encoded */
    Mono<String> signTransfer(TransferInstruction instruction);
}

package com.sentinelplatform.scheduler.custody;

public interface WalletCustody {

    WalletSigner signerFor(String walletAddress);
}

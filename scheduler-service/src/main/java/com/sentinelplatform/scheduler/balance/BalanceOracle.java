package com.sentinelplatform.scheduler.balance;

import com.sentinelplatform.common.exception.UnsupportedTokenException;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;
import com.sentinelplatform.common.network.NetworkProfile;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import com.sentinelplatform.common.rpc.SolanaRpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Read-only wallet balances on the agent's own network.
 *
 * <p>An RPC failure is an error signal
 * ({@link com.sentinelplatform.common.exception.NetworkUnavailableException}), never a zero
 * balance: callers must not mistake "unknown" for "empty".
 */
@Component
public class BalanceOracle {

    private static final Logger log = LoggerFactory.getLogger(BalanceOracle.class);

    static final BigDecimal FUNDED_MINIMUM      = new BigDecimal("0.01");
    static final BigDecimal NATIVE_FEE_ESTIMATE = new BigDecimal("0.00001");

    private final SolanaRpcClient rpc;
    private final NetworkProfileResolver resolver;
    private final BigDecimal checkFee;

    public BalanceOracle(SolanaRpcClient rpc,
                         NetworkProfileResolver resolver,
                         @Value("${sentinel.check-fee:0.0001}") BigDecimal checkFee) {
        this.rpc      = rpc;
        this.resolver = resolver;
        this.checkFee = checkFee;
    }

    public Mono<BigDecimal> getNativeBalance(String address, NetworkType network) {
        return rpc.getBalance(network, address)
            .doOnNext(b -> log.debug("Native balance. address={} network={} balance={}",
                                     address, network.wireValue(), b));
    }

    public Mono<BigDecimal> getStablecoinBalance(String address, PaymentToken token, NetworkType network) {
        NetworkProfile profile = resolver.profileFor(network);
        if (!profile.supports(token)) {
            return Mono.error(new UnsupportedTokenException(token, profile.type()));
        }
        return rpc.getTokenBalance(network, address, profile.tokenSpec(token).mint())
            .doOnNext(b -> log.debug("Token balance. address={} token={} network={} balance={}",
                                     address, token, network.wireValue(), b));
    }

    /** Both balances plus a funded flag and a rough count of checks the wallet can still pay for. */
    public Mono<WalletBalances> walletBalances(String address, PaymentToken token, NetworkType network) {
        return Mono.zip(getNativeBalance(address, network), getStablecoinBalance(address, token, network))
            .map(t -> {
                BigDecimal nativeBalance = t.getT1();
                BigDecimal tokenBalance  = t.getT2();
                boolean funded = nativeBalance.compareTo(FUNDED_MINIMUM) >= 0
                                 && tokenBalance.compareTo(FUNDED_MINIMUM) >= 0;
                long byToken  = tokenBalance.divide(checkFee, 0, RoundingMode.FLOOR).longValue();
                long byNative = nativeBalance.divide(NATIVE_FEE_ESTIMATE, 0, RoundingMode.FLOOR).longValue();
                return new WalletBalances(address, network, nativeBalance, token, tokenBalance,
                                          funded, Math.min(byToken, byNative));
            });
    }
}

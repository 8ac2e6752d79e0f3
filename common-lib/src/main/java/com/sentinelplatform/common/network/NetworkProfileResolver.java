package com.sentinelplatform.common.network;

import com.sentinelplatform.common.model.NetworkType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a {@link NetworkType} to its {@link NetworkProfile}. Both profiles are built once;
 * lookups are pure.
 *
 * <p>{@link #resolveNetwork()} answers for the process as a whole ({@code sentinel.network});
 * payments always go through {@link #profileFor(NetworkType)} with the agent's own network.
 */
public class NetworkProfileResolver {

    private final NetworkType activeNetwork;
    private final Map<NetworkType, NetworkProfile> profiles = new EnumMap<>(NetworkType.class);

    public NetworkProfileResolver(NetworkType activeNetwork, String devnetRpcUrl, String mainnetRpcUrl) {
        this.activeNetwork = activeNetwork != null ? activeNetwork : NetworkType.DEVNET;
        profiles.put(NetworkType.DEVNET, NetworkProfiles.devnet(devnetRpcUrl));
        profiles.put(NetworkType.MAINNET, NetworkProfiles.mainnet(mainnetRpcUrl));
    }

    /** Devnet with public RPC endpoints. */
    public static NetworkProfileResolver defaults() {
        return new NetworkProfileResolver(NetworkType.DEVNET, null, null);
    }

    public NetworkProfile resolveNetwork() {
        return profiles.get(activeNetwork);
    }

    /** A {@code null} network is treated as devnet, the same as an unset configuration. */
    public NetworkProfile profileFor(NetworkType network) {
        return profiles.get(network != null ? network : NetworkType.DEVNET);
    }
}

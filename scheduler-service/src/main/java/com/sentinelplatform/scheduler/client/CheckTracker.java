package com.sentinelplatform.scheduler.client;

import com.sentinelplatform.common.protocol.CheckState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Current protocol state of one check, with every transition logged. */
final class CheckTracker {

    private static final Logger log = LoggerFactory.getLogger(CheckTracker.class);

    private final String sentinelId;
    private volatile CheckState state = CheckState.INIT;

    CheckTracker(String sentinelId) {
        this.sentinelId = sentinelId;
    }

    CheckState state() {
        return state;
    }

    void to(CheckState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Check already " + state + "; cannot move to " + next);
        }
        log.debug("CHECK_STATE sentinelId={} from={} to={}", sentinelId, state, next);
        state = next;
    }
}

package com.sentinelplatform.scheduler.ledger;

/**
 * Lets the owner of a write refuse it. A write only happens between a successful
 * {@link #tryBeginWrite()} and the matching {@link #endWrite()}.
 */
public interface WriteGate {

    WriteGate OPEN = new WriteGate() {
        @Override public boolean tryBeginWrite() { return true; }
        @Override public void endWrite() {}
    };

    boolean tryBeginWrite();

    void endWrite();
}

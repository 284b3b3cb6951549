package com.bit.deposit.event;

public enum SignalType {
    DEPOSIT_DATA_ADDED,
    DEPOSIT_DATA_EDITED,
    DEPOSIT_DATA_DELETED,
    DEPOSITED,
    ACCEPTOR_BOUND,
    OWNERSHIP_TRANSFERRED,
    PAUSED,
    UNPAUSED
}

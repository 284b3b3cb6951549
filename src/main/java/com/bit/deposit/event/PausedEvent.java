package com.bit.deposit.event;

import com.bit.deposit.common.Address;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class PausedEvent extends DepositSignal {
    private final Address account;

    public PausedEvent(Address account) {
        super(SignalType.PAUSED);
        this.account = account;
    }
}

package com.bit.deposit.event;

import com.bit.deposit.common.Address;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class UnpausedEvent extends DepositSignal {
    private final Address account;

    public UnpausedEvent(Address account) {
        super(SignalType.UNPAUSED);
        this.account = account;
    }
}

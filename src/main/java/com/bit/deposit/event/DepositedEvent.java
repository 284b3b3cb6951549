package com.bit.deposit.event;

import com.bit.deposit.common.Address;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class DepositedEvent extends DepositSignal {
    private final Address sender;
    private final int count;

    public DepositedEvent(Address sender, int count) {
        super(SignalType.DEPOSITED);
        this.sender = sender;
        this.count = count;
    }
}

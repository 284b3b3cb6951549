package com.bit.deposit.event;

import com.bit.deposit.common.Address;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class AcceptorBoundEvent extends DepositSignal {
    private final Address acceptorAddress;

    public AcceptorBoundEvent(Address acceptorAddress) {
        super(SignalType.ACCEPTOR_BOUND);
        this.acceptorAddress = acceptorAddress;
    }
}

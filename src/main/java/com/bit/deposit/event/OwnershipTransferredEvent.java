package com.bit.deposit.event;

import com.bit.deposit.common.Address;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class OwnershipTransferredEvent extends DepositSignal {
    private final Address previousOwner;
    private final Address newOwner;

    public OwnershipTransferredEvent(Address previousOwner, Address newOwner) {
        super(SignalType.OWNERSHIP_TRANSFERRED);
        this.previousOwner = previousOwner;
        this.newOwner = newOwner;
    }
}

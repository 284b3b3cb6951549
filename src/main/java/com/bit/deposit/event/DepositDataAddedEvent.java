package com.bit.deposit.event;

import com.bit.deposit.common.Address;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class DepositDataAddedEvent extends DepositSignal {
    private final Address beneficiary;
    private final int count;

    public DepositDataAddedEvent(Address beneficiary, int count) {
        super(SignalType.DEPOSIT_DATA_ADDED);
        this.beneficiary = beneficiary;
        this.count = count;
    }
}

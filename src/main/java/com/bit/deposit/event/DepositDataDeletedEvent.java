package com.bit.deposit.event;

import com.bit.deposit.common.Address;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class DepositDataDeletedEvent extends DepositSignal {
    private final Address beneficiary;
    private final int count;

    public DepositDataDeletedEvent(Address beneficiary, int count) {
        super(SignalType.DEPOSIT_DATA_DELETED);
        this.beneficiary = beneficiary;
        this.count = count;
    }
}

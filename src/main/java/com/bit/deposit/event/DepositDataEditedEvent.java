package com.bit.deposit.event;

import com.bit.deposit.common.Address;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class DepositDataEditedEvent extends DepositSignal {
    private final Address beneficiary;
    private final int index;

    public DepositDataEditedEvent(Address beneficiary, int index) {
        super(SignalType.DEPOSIT_DATA_EDITED);
        this.beneficiary = beneficiary;
        this.index = index;
    }
}

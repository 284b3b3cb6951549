package com.bit.deposit.structure.deposit;

import com.bit.deposit.common.Address;
import com.google.common.collect.ImmutableList;
import lombok.Getter;

import java.util.List;

/**
 * 受益人存款队列的只读视图
 * 队列内部按整条记录存储，四个并行序列由记录派生，长度恒等
 */
@Getter
public final class BeneficiaryQueue {

    private final Address beneficiary;
    private final ImmutableList<DepositRecord> records;

    public BeneficiaryQueue(Address beneficiary, List<DepositRecord> records) {
        this.beneficiary = beneficiary;
        this.records = ImmutableList.copyOf(records);
    }

    public static BeneficiaryQueue empty(Address beneficiary) {
        return new BeneficiaryQueue(beneficiary, ImmutableList.of());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public DepositRecord get(int index) {
        return records.get(index);
    }

    public List<byte[]> getPubkeys() {
        return records.stream().map(DepositRecord::getPubkey).collect(ImmutableList.toImmutableList());
    }

    public List<byte[]> getWithdrawalCredentials() {
        return records.stream().map(DepositRecord::getWithdrawalCredentials).collect(ImmutableList.toImmutableList());
    }

    public List<byte[]> getSignatures() {
        return records.stream().map(DepositRecord::getSignature).collect(ImmutableList.toImmutableList());
    }

    public List<byte[]> getDepositDataRoots() {
        return records.stream().map(DepositRecord::getDepositDataRoot).collect(ImmutableList.toImmutableList());
    }
}

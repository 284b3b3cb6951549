package com.bit.deposit.editor;

import com.bit.deposit.common.Address;
import com.bit.deposit.structure.deposit.BeneficiaryQueue;

import java.util.List;

/**
 * 所有者对受益人存款队列的批量编辑
 */
public interface BatchEditor {

    /**
     * 按输入顺序追加一批存款记录
     * @param caller 调用者，必须为所有者
     * @return 追加后的队列长度
     */
    int addDepositData(Address caller, Address beneficiary, List<byte[]> pubkeys, List<byte[]> withdrawalCredentials,
                       List<byte[]> signatures, List<byte[]> depositDataRoots);

    /**
     * 原地覆盖指定位置的记录
     */
    void editDepositData(Address caller, Address beneficiary, byte[] pubkey, byte[] withdrawalCredential,
                         byte[] signature, byte[] depositDataRoot, int index);

    /**
     * 删除最后追加的 count 条记录
     * @return 删除后的队列长度
     */
    int deleteLastNDepositEntries(Address caller, Address beneficiary, int count);

    /**
     * 清空队列，空队列上调用同样成功
     * @return 清空前的长度
     */
    int deleteAllEntries(Address caller, Address beneficiary);

    /**
     * 查询受益人当前队列，无访问限制
     */
    BeneficiaryQueue getStakerData(Address beneficiary);
}

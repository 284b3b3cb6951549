package com.bit.deposit.store;

import com.bit.deposit.common.Address;
import com.bit.deposit.structure.deposit.BeneficiaryQueue;
import com.bit.deposit.structure.deposit.DepositRecord;

import java.util.List;

//受益人 -> 存款队列 的唯一持有者，只允许批量编辑与存款触发调用
public interface RecordStore {

    /**
     * 获取受益人队列的只读视图，不存在时返回空队列
     * @param beneficiary
     * @return
     */
    BeneficiaryQueue get(Address beneficiary);

    /**
     * 队列长度
     * @param beneficiary
     * @return
     */
    int size(Address beneficiary);

    /**
     * 追加一条记录
     * @param beneficiary
     * @param record
     */
    void append(Address beneficiary, DepositRecord record);

    /**
     * 按顺序追加多条记录，一次完成
     * @param beneficiary
     * @param records
     */
    void appendAll(Address beneficiary, List<DepositRecord> records);

    /**
     * 覆盖指定位置的记录
     * @param beneficiary
     * @param index
     * @param record
     * @throws com.bit.deposit.error.DepositException INDEX_OUT_OF_RANGE
     */
    void setAt(Address beneficiary, int index, DepositRecord record);

    /**
     * 删除最后追加的n条记录
     * @param beneficiary
     * @param n
     * @throws com.bit.deposit.error.DepositException INDEX_OUT_OF_RANGE
     */
    void popLastN(Address beneficiary, int n);

    /**
     * 清空队列
     * @param beneficiary
     * @return 清空前的长度
     */
    int clear(Address beneficiary);
}

package com.bit.deposit.store.memory;

import com.bit.deposit.common.Address;
import com.bit.deposit.error.DepositException;
import com.bit.deposit.store.RecordStore;
import com.bit.deposit.structure.deposit.BeneficiaryQueue;
import com.bit.deposit.structure.deposit.DepositRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 内存存款队列
 * 每个受益人的队列在 compute 内整体替换，读取方只会看到完整提交后的队列
 */
@Component
public class MemoryRecordStore implements RecordStore {

    private final ConcurrentMap<Address, List<DepositRecord>> queues = new ConcurrentHashMap<>();

    @Override
    public BeneficiaryQueue get(Address beneficiary) {
        List<DepositRecord> records = queues.get(beneficiary);
        if (records == null) {
            return BeneficiaryQueue.empty(beneficiary);
        }
        return new BeneficiaryQueue(beneficiary, records);
    }

    @Override
    public int size(Address beneficiary) {
        List<DepositRecord> records = queues.get(beneficiary);
        return records == null ? 0 : records.size();
    }

    @Override
    public void append(Address beneficiary, DepositRecord record) {
        appendAll(beneficiary, List.of(record));
    }

    @Override
    public void appendAll(Address beneficiary, List<DepositRecord> records) {
        queues.compute(beneficiary, (key, current) -> {
            List<DepositRecord> next = current == null ? new ArrayList<>(records.size()) : new ArrayList<>(current);
            next.addAll(records);
            return next;
        });
    }

    @Override
    public void setAt(Address beneficiary, int index, DepositRecord record) {
        queues.compute(beneficiary, (key, current) -> {
            int size = current == null ? 0 : current.size();
            if (index < 0 || index >= size) {
                throw DepositException.indexOutOfRange("索引" + index + "超出队列长度" + size);
            }
            List<DepositRecord> next = new ArrayList<>(current);
            next.set(index, record);
            return next;
        });
    }

    @Override
    public void popLastN(Address beneficiary, int n) {
        queues.compute(beneficiary, (key, current) -> {
            int size = current == null ? 0 : current.size();
            if (n < 0 || n > size) {
                throw DepositException.indexOutOfRange("删除数量" + n + "超出队列长度" + size);
            }
            if (n == size) {
                return null;
            }
            return new ArrayList<>(current.subList(0, size - n));
        });
    }

    @Override
    public int clear(Address beneficiary) {
        List<DepositRecord> removed = queues.remove(beneficiary);
        return removed == null ? 0 : removed.size();
    }
}

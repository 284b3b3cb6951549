package com.bit.deposit.editor.impl;

import com.bit.deposit.aop.annotation.Caller;
import com.bit.deposit.aop.annotation.OwnerOnly;
import com.bit.deposit.common.Address;
import com.bit.deposit.config.DepositConfig;
import com.bit.deposit.config.DepositConstants;
import com.bit.deposit.editor.BatchEditor;
import com.bit.deposit.editor.DepositRecordValidator;
import com.bit.deposit.error.DepositException;
import com.bit.deposit.event.DepositDataAddedEvent;
import com.bit.deposit.event.DepositDataDeletedEvent;
import com.bit.deposit.event.DepositDataEditedEvent;
import com.bit.deposit.store.RecordStore;
import com.bit.deposit.structure.deposit.BeneficiaryQueue;
import com.bit.deposit.structure.deposit.DepositRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class BatchEditorImpl implements BatchEditor {

    private final RecordStore recordStore;
    private final ApplicationEventPublisher publisher;
    // 添加时是否校验字节长度，默认不校验，由编辑与存款接收方兜底
    private final boolean strictAddValidation;

    public BatchEditorImpl(RecordStore recordStore, ApplicationEventPublisher publisher, DepositConfig config) {
        this.recordStore = recordStore;
        this.publisher = publisher;
        this.strictAddValidation = config.isStrictAddValidation();
    }

    @Override
    @OwnerOnly
    public int addDepositData(@Caller Address caller, Address beneficiary, List<byte[]> pubkeys,
                              List<byte[]> withdrawalCredentials, List<byte[]> signatures,
                              List<byte[]> depositDataRoots) {
        requireBeneficiary(beneficiary);
        if (pubkeys == null || withdrawalCredentials == null || signatures == null || depositDataRoots == null) {
            throw DepositException.invalidArgument("存款参数不能为空");
        }
        int count = pubkeys.size();
        if (count == 0
                || withdrawalCredentials.size() != count
                || signatures.size() != count
                || depositDataRoots.size() != count) {
            throw DepositException.invalidArgument("四组参数长度必须一致且不为0: pubkeys=" + count
                    + ", credentials=" + withdrawalCredentials.size()
                    + ", signatures=" + signatures.size()
                    + ", roots=" + depositDataRoots.size());
        }
        if (count > DepositConstants.ADD_LIMIT) {
            throw DepositException.invalidArgument("单次最多添加" + DepositConstants.ADD_LIMIT + "条，实际" + count);
        }

        // 先全部构建与校验，再一次性写入
        List<DepositRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte[] pubkey = pubkeys.get(i);
            byte[] credential = withdrawalCredentials.get(i);
            byte[] signature = signatures.get(i);
            byte[] root = depositDataRoots.get(i);
            if (strictAddValidation) {
                DepositRecordValidator.requireWellFormed(pubkey, credential, signature, root);
            } else if (pubkey == null || credential == null || signature == null || root == null) {
                throw DepositException.invalidArgument("第" + i + "条存款参数为空");
            }
            records.add(new DepositRecord(pubkey, credential, signature, root));
        }
        recordStore.appendAll(beneficiary, records);
        int size = recordStore.size(beneficiary);
        log.info("添加存款数据 | 受益人: {} | 本次: {} | 队列长度: {}", beneficiary, count, size);
        publisher.publishEvent(new DepositDataAddedEvent(beneficiary, count));
        return size;
    }

    @Override
    @OwnerOnly
    public void editDepositData(@Caller Address caller, Address beneficiary, byte[] pubkey, byte[] withdrawalCredential,
                                byte[] signature, byte[] depositDataRoot, int index) {
        requireBeneficiary(beneficiary);
        int size = recordStore.size(beneficiary);
        if (index < 0 || index >= size) {
            throw DepositException.indexOutOfRange("索引" + index + "超出队列长度" + size);
        }
        DepositRecordValidator.requireWellFormed(pubkey, withdrawalCredential, signature, depositDataRoot);
        recordStore.setAt(beneficiary, index, new DepositRecord(pubkey, withdrawalCredential, signature, depositDataRoot));
        log.info("编辑存款数据 | 受益人: {} | 索引: {}", beneficiary, index);
        publisher.publishEvent(new DepositDataEditedEvent(beneficiary, index));
    }

    @Override
    @OwnerOnly
    public int deleteLastNDepositEntries(@Caller Address caller, Address beneficiary, int count) {
        requireBeneficiary(beneficiary);
        int size = recordStore.size(beneficiary);
        if (count <= 0 || count > size) {
            throw DepositException.invalidArgument("删除数量必须在1到" + size + "之间，实际" + count);
        }
        recordStore.popLastN(beneficiary, count);
        log.info("删除存款数据 | 受益人: {} | 删除: {} | 剩余: {}", beneficiary, count, size - count);
        publisher.publishEvent(new DepositDataDeletedEvent(beneficiary, count));
        return size - count;
    }

    @Override
    @OwnerOnly
    public int deleteAllEntries(@Caller Address caller, Address beneficiary) {
        requireBeneficiary(beneficiary);
        int previous = recordStore.clear(beneficiary);
        log.info("清空存款数据 | 受益人: {} | 删除: {}", beneficiary, previous);
        publisher.publishEvent(new DepositDataDeletedEvent(beneficiary, previous));
        return previous;
    }

    @Override
    public BeneficiaryQueue getStakerData(Address beneficiary) {
        requireBeneficiary(beneficiary);
        return recordStore.get(beneficiary);
    }

    private void requireBeneficiary(Address beneficiary) {
        if (beneficiary == null) {
            throw DepositException.invalidArgument("受益人地址不能为空");
        }
    }
}

package com.bit.deposit.trigger.impl;

import com.bit.deposit.acceptor.DepositAcceptor;
import com.bit.deposit.acceptor.DepositRejectedException;
import com.bit.deposit.aop.annotation.Caller;
import com.bit.deposit.aop.annotation.WhenNotPaused;
import com.bit.deposit.common.Address;
import com.bit.deposit.config.DepositConstants;
import com.bit.deposit.error.DepositException;
import com.bit.deposit.error.ErrorType;
import com.bit.deposit.event.AcceptorBoundEvent;
import com.bit.deposit.event.DepositedEvent;
import com.bit.deposit.store.RecordStore;
import com.bit.deposit.structure.deposit.BeneficiaryQueue;
import com.bit.deposit.structure.deposit.DepositReceipt;
import com.bit.deposit.structure.deposit.DepositRecord;
import com.bit.deposit.trigger.DepositTrigger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

@Slf4j
@Service
public class DepositTriggerImpl implements DepositTrigger {

    private final RecordStore recordStore;
    private final DepositAcceptor acceptor;
    private final ApplicationEventPublisher publisher;

    public DepositTriggerImpl(RecordStore recordStore, DepositAcceptor acceptor, ApplicationEventPublisher publisher) {
        this.recordStore = recordStore;
        this.acceptor = acceptor;
        this.publisher = publisher;
    }

    /**
     * 容器完全初始化后公布绑定的存款接收方
     */
    @EventListener(ContextRefreshedEvent.class)
    public void announceAcceptor() {
        log.info("存款接收方已绑定: {}", acceptor.address());
        publisher.publishEvent(new AcceptorBoundEvent(acceptor.address()));
    }

    @Override
    @WhenNotPaused
    public DepositReceipt receive(@Caller Address sender, BigInteger value) {
        if (sender == null) {
            throw DepositException.invalidArgument("转入方地址不能为空");
        }
        BeneficiaryQueue queue = recordStore.get(sender);
        if (queue.isEmpty()) {
            throw DepositException.unauthorized("用户不在白名单: " + sender);
        }
        int count = queue.size();
        BigInteger expected = DepositConstants.COLLATERAL.multiply(BigInteger.valueOf(count));
        if (value == null || value.compareTo(expected) != 0) {
            throw DepositException.invalidArgument("金额与节点数不匹配: 期望" + expected + "，实际" + value);
        }
        if (count > DepositConstants.DEPOSIT_LIMIT) {
            throw DepositException.invalidArgument("单次最多存入" + DepositConstants.DEPOSIT_LIMIT + "个节点，实际" + count);
        }

        forwardAll(sender, queue);

        recordStore.clear(sender);
        log.info("存款完成 | 转入方: {} | 节点数: {} | 金额: {}", sender, count, value);
        publisher.publishEvent(new DepositedEvent(sender, count));
        return new DepositReceipt(sender, count, value, acceptor.getDepositCount());
    }

    /**
     * 在同一个帧内转发全部记录，任一失败整体回滚，队列保持不变
     */
    private void forwardAll(Address sender, BeneficiaryQueue queue) {
        acceptor.beginFrame();
        int index = 0;
        try {
            for (DepositRecord record : queue.getRecords()) {
                acceptor.submit(record, DepositConstants.COLLATERAL);
                index++;
            }
            acceptor.commitFrame();
        } catch (DepositRejectedException e) {
            acceptor.revertFrame();
            throw new DepositException(ErrorType.DEPOSIT_REJECTED,
                    "第" + index + "条存款被拒绝(" + sender + "): " + e.getMessage(), e);
        } catch (RuntimeException e) {
            acceptor.revertFrame();
            throw e;
        }
    }
}

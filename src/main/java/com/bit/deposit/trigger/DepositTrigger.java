package com.bit.deposit.trigger;

import com.bit.deposit.common.Address;
import com.bit.deposit.structure.deposit.DepositReceipt;

import java.math.BigInteger;

/**
 * 受益人转入金额触发队列中全部存款
 */
public interface DepositTrigger {

    /**
     * 处理一笔转入：金额必须等于 队列长度 * 32 ETH，逐条转发给存款接收方后清空队列
     * 全部成功或全部回滚
     * @param sender 转入方（受益人）
     * @param value 转入金额（wei）
     * @return 存款回执
     */
    DepositReceipt receive(Address sender, BigInteger value);
}

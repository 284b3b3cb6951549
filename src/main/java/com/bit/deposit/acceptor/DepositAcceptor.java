package com.bit.deposit.acceptor;

import com.bit.deposit.common.Address;
import com.bit.deposit.structure.deposit.DepositRecord;

import java.math.BigInteger;

/**
 * 外部存款接收服务的边界契约：给定一条记录与对应金额，登记一个验证者
 *
 * <p>一次触发内的多次提交放在同一个帧内：{@code beginFrame()} 之后的提交先缓存，
 * {@code commitFrame()} 一次生效，{@code revertFrame()} 全部丢弃。
 * 帧外的提交立即生效。
 */
public interface DepositAcceptor {

    /**
     * 接收方地址
     */
    Address address();

    /**
     * 开启一个帧
     * @throws IllegalStateException 已有未结束的帧
     */
    void beginFrame();

    /**
     * 提交一笔存款，任何格式错误或状态冲突都拒绝
     * @param record 存款记录
     * @param amount 随附金额（wei）
     * @throws DepositRejectedException 拒绝
     */
    void submit(DepositRecord record, BigInteger amount);

    /**
     * 提交当前帧内的全部存款
     * @throws IllegalStateException 没有进行中的帧
     */
    void commitFrame();

    /**
     * 丢弃当前帧内的全部存款，没有帧时忽略
     */
    void revertFrame();

    /**
     * 已生效的存款总数
     */
    long getDepositCount();
}

package com.bit.deposit.structure.deposit;

import com.bit.deposit.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

/**
 * 一次触发存款的结果
 */
@Data
@AllArgsConstructor
public class DepositReceipt {
    private Address sender;
    private int count;//转发的记录数
    private BigInteger totalValue;//wei
    private long acceptorDepositCount;//接收方累计存款数
}

package com.bit.deposit.config;

import java.math.BigInteger;

public final class DepositConstants {

    private DepositConstants() {
    }

    public static final int PUBKEY_LENGTH = 48;
    public static final int CREDENTIALS_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 96;

    // 单次添加上限
    public static final int ADD_LIMIT = 100;
    // 单次触发存款上限，与添加上限相互独立，多次添加可累积超过该值
    public static final int DEPOSIT_LIMIT = 150;

    public static final BigInteger GWEI = BigInteger.TEN.pow(9);
    public static final BigInteger ETHER = BigInteger.TEN.pow(18);

    // 每个验证者的质押金额 32 ETH（单位 wei）
    public static final BigInteger COLLATERAL = ETHER.multiply(BigInteger.valueOf(32));
}

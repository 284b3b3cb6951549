package com.bit.deposit.common;

/**
 * 存款数据根（32字节），对编码后的存款消息的SSZ哈希承诺
 */
public class DepositDataRoot extends ByteHash32 {

    public DepositDataRoot(byte[] value) {
        super(value);
    }

    public static DepositDataRoot fromBytes(byte[] bytes) {
        return new DepositDataRoot(bytes);
    }
}

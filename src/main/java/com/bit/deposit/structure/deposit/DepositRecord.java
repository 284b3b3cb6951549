package com.bit.deposit.structure.deposit;

import com.bit.deposit.util.ByteUtils;
import lombok.EqualsAndHashCode;

import java.util.Arrays;

/**
 * 单个验证者的存款参数：公钥(48) 提款凭证(32) 签名(96) 存款数据根(32)
 * 写入后不可变，出入均做拷贝
 */
@EqualsAndHashCode
public final class DepositRecord {

    private final byte[] pubkey;
    private final byte[] withdrawalCredentials;
    private final byte[] signature;
    private final byte[] depositDataRoot;

    public DepositRecord(byte[] pubkey, byte[] withdrawalCredentials, byte[] signature, byte[] depositDataRoot) {
        if (pubkey == null || withdrawalCredentials == null || signature == null || depositDataRoot == null) {
            throw new IllegalArgumentException("存款参数不能为空");
        }
        this.pubkey = pubkey.clone();
        this.withdrawalCredentials = withdrawalCredentials.clone();
        this.signature = signature.clone();
        this.depositDataRoot = depositDataRoot.clone();
    }

    public byte[] getPubkey() {
        return pubkey.clone();
    }

    public byte[] getWithdrawalCredentials() {
        return withdrawalCredentials.clone();
    }

    public byte[] getSignature() {
        return signature.clone();
    }

    public byte[] getDepositDataRoot() {
        return depositDataRoot.clone();
    }

    @Override
    public String toString() {
        // 只打印公钥前4字节
        String hex = ByteUtils.toPrefixedHex(Arrays.copyOf(pubkey, Math.min(pubkey.length, 4)));
        return "DepositRecord(pubkey=" + hex + "..., pubkeyLength=" + pubkey.length + ")";
    }
}

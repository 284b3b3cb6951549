package com.bit.deposit.editor;

import com.bit.deposit.common.ByteHash32;
import com.bit.deposit.config.DepositConstants;
import com.bit.deposit.error.DepositException;

/**
 * 存款参数字节长度校验
 */
public final class DepositRecordValidator {

    private DepositRecordValidator() {
    }

    public static void requireWellFormed(byte[] pubkey, byte[] withdrawalCredentials, byte[] signature, byte[] depositDataRoot) {
        requireLength("pubkey", pubkey, DepositConstants.PUBKEY_LENGTH);
        requireLength("withdrawal_credentials", withdrawalCredentials, DepositConstants.CREDENTIALS_LENGTH);
        requireLength("signature", signature, DepositConstants.SIGNATURE_LENGTH);
        requireLength("deposit_data_root", depositDataRoot, ByteHash32.HASH_LENGTH);
    }

    private static void requireLength(String field, byte[] value, int expected) {
        if (value == null || value.length != expected) {
            int actual = value == null ? -1 : value.length;
            throw DepositException.invalidArgument(field + "长度必须为" + expected + "字节，实际" + actual);
        }
    }
}

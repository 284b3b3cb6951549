package com.bit.deposit.api;

import com.bit.deposit.common.Address;
import com.bit.deposit.error.DepositException;
import com.bit.deposit.util.ByteUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 接口参数解析，格式错误统一转为 INVALID_ARGUMENT
 */
final class RequestParser {

    private RequestParser() {
    }

    static Address address(String field, String hex) {
        try {
            return Address.fromHex(hex);
        } catch (IllegalArgumentException e) {
            throw DepositException.invalidArgument(field + "不是合法地址: " + hex);
        }
    }

    static byte[] bytes(String field, String hex) {
        try {
            return ByteUtils.hexToBytes(hex);
        } catch (IllegalArgumentException e) {
            throw DepositException.invalidArgument(field + "不是合法十六进制: " + hex);
        }
    }

    static List<byte[]> bytesList(String field, List<String> hexList) {
        if (hexList == null) {
            return null;
        }
        List<byte[]> result = new ArrayList<>(hexList.size());
        for (int i = 0; i < hexList.size(); i++) {
            result.add(bytes(field + "[" + i + "]", hexList.get(i)));
        }
        return result;
    }

    static BigInteger wei(String value) {
        if (value == null) {
            throw DepositException.invalidArgument("金额不能为空");
        }
        try {
            return new BigInteger(value.trim());
        } catch (NumberFormatException e) {
            throw DepositException.invalidArgument("金额不是合法整数: " + value);
        }
    }

    static int integer(String field, Integer value) {
        if (value == null) {
            throw DepositException.invalidArgument(field + "不能为空");
        }
        return value;
    }
}

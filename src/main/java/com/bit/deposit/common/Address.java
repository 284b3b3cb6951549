package com.bit.deposit.common;

import com.bit.deposit.util.ByteUtils;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 账户地址（20字节），受益人与所有者的统一身份表示
 */
@EqualsAndHashCode
public final class Address implements Serializable, Comparable<Address> {
    public static final int LENGTH = 20;

    public static final Address ZERO = new Address(new byte[LENGTH]);

    private final byte[] value;

    private Address(byte[] value) {
        if (value == null || value.length != LENGTH) {
            throw new IllegalArgumentException("地址必须为20字节");
        }
        this.value = Arrays.copyOf(value, LENGTH);
    }

    public static Address fromBytes(byte[] bytes) {
        return new Address(bytes);
    }

    /**
     * 解析0x前缀（可省略）的40位十六进制地址，大小写不敏感
     */
    public static Address fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("地址不能为空");
        }
        return new Address(ByteUtils.hexToBytes(hex.trim()));
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    public boolean isZero() {
        return Arrays.equals(value, ZERO.value);
    }

    @Override
    public int compareTo(Address other) {
        return Arrays.compareUnsigned(value, other.value);
    }

    @JsonValue
    public String toHex() {
        return ByteUtils.HEX_PREFIX + ByteUtils.bytesToHex(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}

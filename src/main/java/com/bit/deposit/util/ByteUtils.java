package com.bit.deposit.util;

public class ByteUtils {

    public static final String HEX_PREFIX = "0x";

    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

    /**
     * long 转 8字节小端（SSZ uint64 编码）
     */
    public static byte[] longToLittleEndian(long value) {
        byte[] bytes = new byte[8];
        for (int i = 0; i < 8; i++) {
            bytes[i] = (byte) (value >>> (8 * i));
        }
        return bytes;
    }

    /**
     * 字节数组转十六进制字符串（小写，无前缀）
     */
    public static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(HEX_CHARS[(b >>> 4) & 0x0F]);
            sb.append(HEX_CHARS[b & 0x0F]);
        }
        return sb.toString();
    }

    /**
     * 字节数组转0x前缀十六进制
     */
    public static String toPrefixedHex(byte[] bytes) {
        return HEX_PREFIX + bytesToHex(bytes);
    }

    /**
     * 十六进制字符串转字节数组，允许0x前缀
     * @throws IllegalArgumentException 长度为奇数或含非法字符
     */
    public static byte[] hexToBytes(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("十六进制字符串不能为空");
        }
        String h = hex.startsWith(HEX_PREFIX) || hex.startsWith("0X") ? hex.substring(2) : hex;
        int len = h.length();
        if (len % 2 != 0) {
            throw new IllegalArgumentException("十六进制长度必须为偶数: " + hex);
        }
        byte[] data = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int high = Character.digit(h.charAt(i), 16);
            int low = Character.digit(h.charAt(i + 1), 16);
            if (high == -1 || low == -1) {
                throw new IllegalArgumentException("非法十六进制字符: " + hex);
            }
            data[i / 2] = (byte) ((high << 4) | low);
        }
        return data;
    }

    /**
     * 多段字节拼接
     */
    public static byte[] concat(byte[]... parts) {
        int total = 0;
        for (byte[] part : parts) {
            total += part.length;
        }
        byte[] combined = new byte[total];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, combined, offset, part.length);
            offset += part.length;
        }
        return combined;
    }
}

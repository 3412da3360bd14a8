package com.weixiao.caf.utils;

import lombok.experimental.UtilityClass;

/**
 * 十六进制与字节互转工具，用于 oid（小写 hex）与二进制摘要、tree 记录中的定长 hash 等。
 */
@UtilityClass
public class HexUtils {

    private static final String HEX_CHARSET = "0123456789abcdef";

    /**
     * 将偶数长度的十六进制字符串转为字节。
     * 例："0b4e" → {0x0b, 0x4e}。
     *
     * @param hex 由 0-9a-f 组成的字符串
     * @return hex.length() / 2 个字节
     */
    public static byte[] hexToBytes(String hex) {
        if (hex == null || hex.length() % 2 != 0) {
            throw new IllegalArgumentException("hex must have even length, got: " + (hex == null ? "null" : hex.length()));
        }
        byte[] b = new byte[hex.length() / 2];
        for (int i = 0; i < b.length; i++) {
            int hi = Character.digit(hex.charAt(i * 2), 16);
            int lo = Character.digit(hex.charAt(i * 2 + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("not a hex string: " + hex);
            }
            b[i] = (byte) ((hi << 4) | lo);
        }
        return b;
    }

    /**
     * 将字节数组转为小写十六进制字符串（如 SHA-1 的 40 字符 oid）。
     *
     * @param bytes 任意长度
     * @return 小写 hex 字符串
     */
    public static String bytesToHex(byte[] bytes) {
        if (bytes == null) return "";
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(HEX_CHARSET.charAt((b >> 4) & 0x0f));
            sb.append(HEX_CHARSET.charAt(b & 0x0f));
        }
        return sb.toString();
    }

    /**
     * 判断字符串是否为合法的 oid：长度等于 length 且每个字符都在 0-9a-f 中（区分大小写）。
     */
    public static boolean isHash(String s, int length) {
        if (s == null || s.length() != length) return false;
        for (int i = 0; i < s.length(); i++) {
            if (HEX_CHARSET.indexOf(s.charAt(i)) < 0) return false;
        }
        return true;
    }
}

package org.muma.respkv.rdb;

import java.nio.charset.StandardCharsets;

public class RdbConstants {

    // Header: REDIS0011
    public static final byte[] MAGIC = "REDIS".getBytes(StandardCharsets.US_ASCII);
    public static final String VERSION = "0011";

    // --- OpCodes (操作码) ---

    // 标识 RDB 文件结束
    public static final int OP_EOF = 0xFF; // 255

    // 标识辅助字段 (Auxiliary field)
    public static final int OP_AUX = 0xFA; // 250

    // EOF 之后的 CRC64 校验和
    public static final int CHECKSUM_LENGTH = 8;

    private RdbConstants() {
    }
}

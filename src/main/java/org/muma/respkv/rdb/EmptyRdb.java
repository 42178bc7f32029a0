package org.muma.respkv.rdb;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * 空数据库的 RDB 快照 (redis 7.2 生成，只含 AUX 字段)
 * 全量同步时原样发给 Slave，不做真正的持久化。
 */
public final class EmptyRdb {

    private static final byte[] CONTENT = HexFormat.of().parseHex(
            "524544495330303131"                         // REDIS0011
                    + "fa0972656469732d76657205372e322e30"   // redis-ver 7.2.0
                    + "fa0a72656469732d62697473c040"         // redis-bits 64
                    + "fa056374696d65c26d08bc65"             // ctime
                    + "fa08757365642d6d656dc2b0c41000"       // used-mem
                    + "fa08616f662d62617365c000"             // aof-base 0
                    + "ff"                                   // EOF
                    + "f06e3bfec0ff5aa2");                   // checksum

    private EmptyRdb() {
    }

    public static byte[] content() {
        return CONTENT.clone();
    }

    /**
     * 只检查文件头，够用来发现对端发来的不是 RDB
     */
    public static boolean hasRdbHeader(byte[] data) {
        int headerLength = RdbConstants.MAGIC.length + RdbConstants.VERSION.length();
        return data != null
                && data.length >= headerLength
                && Arrays.equals(data, 0, RdbConstants.MAGIC.length, RdbConstants.MAGIC, 0, RdbConstants.MAGIC.length);
    }
}

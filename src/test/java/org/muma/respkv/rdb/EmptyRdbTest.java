package org.muma.respkv.rdb;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class EmptyRdbTest {

    @Test
    void testSnapshotStructure() {
        byte[] rdb = EmptyRdb.content();

        assertEquals(88, rdb.length);
        String header = new String(rdb, 0, 9, StandardCharsets.US_ASCII);
        assertEquals("REDIS" + RdbConstants.VERSION, header);
        assertEquals(RdbConstants.OP_AUX, rdb[9] & 0xff);

        // EOF 后面正好是 8 字节校验和
        assertEquals(RdbConstants.OP_EOF, rdb[rdb.length - RdbConstants.CHECKSUM_LENGTH - 1] & 0xff);
    }

    @Test
    void testContentIsDefensiveCopy() {
        byte[] first = EmptyRdb.content();
        Arrays.fill(first, (byte) 0);
        assertTrue(EmptyRdb.hasRdbHeader(EmptyRdb.content()));
    }

    @Test
    void testHeaderCheck() {
        assertTrue(EmptyRdb.hasRdbHeader("REDIS0011xyz".getBytes(StandardCharsets.US_ASCII)));
        assertFalse(EmptyRdb.hasRdbHeader("REDIS".getBytes(StandardCharsets.US_ASCII)));
        assertFalse(EmptyRdb.hasRdbHeader("HELLO0011".getBytes(StandardCharsets.US_ASCII)));
        assertFalse(EmptyRdb.hasRdbHeader(null));
    }
}

package com.yizhaoqi.filevault.utils;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;


class IdCodecTest {

    @Test
    void testToHex_IsZeroPaddedTo24Characters() {
        assertEquals("000000000000000000000001", IdCodec.toHex(1L));
        assertEquals("0000000000000000000000ff", IdCodec.toHex(255L));
        assertEquals(IdCodec.LENGTH, IdCodec.toHex(Long.MAX_VALUE).length());
        assertNull(IdCodec.toHex((Long) null));
    }

    @Test
    void testParse_AcceptsOwnOutputInEitherCase() {
        assertEquals(Optional.of(42L), IdCodec.parse(IdCodec.toHex(42L)));
        assertEquals(Optional.of(255L), IdCodec.parse("0000000000000000000000FF"));
    }

    @Test
    void testParse_RejectsMalformedValues() {
        assertTrue(IdCodec.parse(null).isEmpty());
        assertTrue(IdCodec.parse("").isEmpty());
        assertTrue(IdCodec.parse("42").isEmpty());
        assertTrue(IdCodec.parse("00000000000000000000002z").isEmpty());
        assertTrue(IdCodec.parse("0000000000000000000000001").isEmpty());
    }

    @Test
    void testParse_RejectsIdsNoRecordCanHave() {
        assertTrue(IdCodec.parse("000000000000000000000000").isEmpty());
        assertTrue(IdCodec.parse("5f1a2b3c4d5e6f7a8b9c0d1e").isEmpty());
        assertTrue(IdCodec.parse("00000000ffffffffffffffff").isEmpty());
    }
}

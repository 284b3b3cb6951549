package com.bit.deposit.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AddressTest {

    @Test
    void parsesMixedCaseWithOrWithoutPrefix() {
        Address checksummed = Address.fromHex("0x00000000219ab540356cBB839Cbe05303d7705Fa");
        Address bare = Address.fromHex("00000000219ab540356cbb839cbe05303d7705fa");
        assertEquals(checksummed, bare);
        assertEquals(checksummed.hashCode(), bare.hashCode());
        assertEquals("0x00000000219ab540356cbb839cbe05303d7705fa", checksummed.toHex());
    }

    @Test
    void rejectsWrongLengthAndBadCharacters() {
        assertThrows(IllegalArgumentException.class, () -> Address.fromHex("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> Address.fromHex("0xzz000000219ab540356cbb839cbe05303d7705fa"));
        assertThrows(IllegalArgumentException.class, () -> Address.fromHex(null));
    }

    @Test
    void zeroAddress() {
        assertTrue(Address.ZERO.isZero());
        assertFalse(Address.fromHex("0x0000000000000000000000000000000000000001").isZero());
    }
}

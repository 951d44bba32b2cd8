package io.deadlockssh.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AddressUtilsTest {

    @ParameterizedTest
    @CsvSource({
            "203.0.113.7, 203.0.113.7",
            "::ffff:203.0.113.7, 203.0.113.7",
            "2001:db8:0:0:0:0:0:1, 2001:db8::1",
            "0:0:0:0:0:0:0:1, ::1"
    })
    void ledgerKey(String literal, String expected) throws UnknownHostException {
        assertEquals(expected, AddressUtils.ledgerKey(InetAddress.getByName(literal)));
    }

    @Test
    void ledgerKeyOfSocketAddress() {
        var socketAddress = new InetSocketAddress("198.51.100.23", 40022);

        assertEquals("198.51.100.23", AddressUtils.ledgerKey(socketAddress));
        assertEquals(40022, AddressUtils.port(socketAddress));
    }

    @Test
    void unresolvedSocketAddressKeepsHostString() {
        var socketAddress = InetSocketAddress.createUnresolved("attacker.invalid", 22);

        assertEquals("attacker.invalid", AddressUtils.ledgerKey(socketAddress));
    }
}

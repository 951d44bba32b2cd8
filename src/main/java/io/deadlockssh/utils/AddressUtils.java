package io.deadlockssh.utils;

import inet.ipaddr.ipv4.IPv4Address;
import inet.ipaddr.ipv6.IPv6Address;
import lombok.NoArgsConstructor;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;

import static java.util.Objects.isNull;
import static lombok.AccessLevel.PRIVATE;

@NoArgsConstructor(access = PRIVATE)
public final class AddressUtils {

    /**
     * Ledger key of a peer: IPv4 in dotted form, IPv4-mapped IPv6 folded to its IPv4 address, other IPv6 in
     * compressed form without zone. A dual-stack listener therefore counts one attacker once.
     */
    public static String ledgerKey(InetAddress address) {
        if (address instanceof Inet6Address) {
            var ipv6 = new IPv6Address(address.getAddress());
            if (ipv6.isIPv4Mapped()) {
                return ipv6.getEmbeddedIPv4Address().toNormalizedString();
            }
            return ipv6.toCompressedString();
        }
        if (address instanceof Inet4Address) {
            return new IPv4Address(address.getAddress()).toNormalizedString();
        }

        return address.getHostAddress();
    }

    public static String ledgerKey(SocketAddress socketAddress) {
        if (socketAddress instanceof InetSocketAddress) {
            var inet = (InetSocketAddress) socketAddress;
            return isNull(inet.getAddress()) ? inet.getHostString() : ledgerKey(inet.getAddress());
        }

        return String.valueOf(socketAddress);
    }

    public static int port(SocketAddress socketAddress) {
        return socketAddress instanceof InetSocketAddress ? ((InetSocketAddress) socketAddress).getPort() : -1;
    }
}

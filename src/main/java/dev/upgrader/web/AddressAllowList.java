package dev.upgrader.web;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Caller allow-list of exact addresses and CIDR ranges (IPv4 and IPv6).
 * An entry that is not a valid address or range only matches the identical string.
 */
final class AddressAllowList {

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern IPV6 = Pattern.compile("[0-9A-Fa-f:.]+");

    private final List<String> entries;

    AddressAllowList(List<String> entries) {
        this.entries = entries.stream()
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
    }

    /**
     * An empty list permits everyone; an unparsable caller is never permitted otherwise.
     */
    boolean permits(String caller) {
        if (entries.isEmpty()) {
            return true;
        }
        byte[] address = parseLiteral(caller);
        if (address == null) {
            return false;
        }
        String callerText = caller.trim();
        return entries.stream().anyMatch(entry -> matches(entry, callerText, address));
    }

    private static boolean matches(String entry, String caller, byte[] address) {
        int slash = entry.indexOf('/');
        byte[] network = parseLiteral(slash >= 0 ? entry.substring(0, slash) : entry);
        if (network == null) {
            return entry.equals(caller);
        }

        int prefix = network.length * 8;
        if (slash >= 0) {
            try {
                prefix = Integer.parseInt(entry.substring(slash + 1).trim());
            } catch (NumberFormatException e) {
                return entry.equals(caller);
            }
            if (prefix < 0 || prefix > network.length * 8) {
                return entry.equals(caller);
            }
        }
        return network.length == address.length && samePrefix(network, address, prefix);
    }

    private static boolean samePrefix(byte[] network, byte[] address, int prefix) {
        int fullBytes = prefix / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (network[i] != address[i]) {
                return false;
            }
        }
        int remainingBits = prefix % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (network[fullBytes] & mask) == (address[fullBytes] & mask);
    }

    /**
     * Raw bytes of an IP literal, or {@code null}. Never resolves host names.
     */
    static byte[] parseLiteral(String value) {
        if (value == null) {
            return null;
        }
        String literal = value.trim();
        boolean ipv4 = IPV4.matcher(literal).matches();
        boolean ipv6 = !ipv4 && literal.indexOf(':') >= 0 && IPV6.matcher(literal).matches();
        if (!ipv4 && !ipv6) {
            return null;
        }
        if (ipv4) {
            for (String octet : literal.split("\\.")) {
                if (Integer.parseInt(octet) > 255) {
                    return null;
                }
            }
        }
        try {
            return InetAddress.getByName(literal).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }
}

package com.example.accesslog.models;

import com.example.accesslog.service.AccessLogException;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Conversions between {@link InetAddress} and the fixed 16-byte storage form, plus the
 * anonymization masks. IPv4 addresses are stored IPv4-mapped ({@code ::ffff:a.b.c.d}).
 */
public final class RemoteOrigins {

    public static final int STORAGE_LENGTH = 16;
    public static final InetAddress LOOPBACK = fromRaw(new byte[] {127, 0, 0, 1});
    // zero-filled storage value, read back for rows without an origin
    public static final InetAddress UNSPECIFIED = fromRaw(new byte[STORAGE_LENGTH]);

    private static final int IPV4_LENGTH = 4;
    // IPv4 keeps 16 bits, IPv6 keeps 48 bits
    private static final int IPV4_KEPT_BYTES = 2;
    private static final int IPV6_KEPT_BYTES = 6;
    private static final Pattern ADDRESS_LITERAL = Pattern.compile(
            "\\d{1,3}(\\.\\d{1,3}){3}|[0-9A-Fa-f.]*:[0-9A-Fa-f:.]*");

    private RemoteOrigins() {
    }

    public static byte[] toStorageBytes(InetAddress address) {
        Objects.requireNonNull(address, "address");
        byte[] raw = address.getAddress();
        if (raw.length == STORAGE_LENGTH) {
            return raw;
        }
        if (raw.length == IPV4_LENGTH) {
            byte[] mapped = new byte[STORAGE_LENGTH];
            mapped[10] = (byte) 0xff;
            mapped[11] = (byte) 0xff;
            System.arraycopy(raw, 0, mapped, 12, IPV4_LENGTH);
            return mapped;
        }
        throw AccessLogException.unsupportedAddressFamily(raw.length);
    }

    /**
     * Reads the storage form back. IPv4-mapped values come back as {@link Inet4Address}.
     */
    public static InetAddress fromStorageBytes(byte[] stored) {
        Objects.requireNonNull(stored, "stored");
        if (stored.length != STORAGE_LENGTH) {
            throw new IllegalArgumentException("Stored remote origin must be " + STORAGE_LENGTH
                    + " bytes, got " + stored.length);
        }
        return fromRaw(stored);
    }

    /**
     * Parses an IP literal without ever falling back to a hostname lookup.
     */
    public static InetAddress parse(String literal) {
        Objects.requireNonNull(literal, "literal");
        String trimmed = literal.trim();
        if (trimmed.isEmpty() || !ADDRESS_LITERAL.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Not an IP address literal: " + literal);
        }
        try {
            return InetAddress.getByName(trimmed);
        } catch (UnknownHostException ex) {
            throw new IllegalArgumentException("Not an IP address literal: " + literal, ex);
        }
    }

    public static InetAddress anonymize(InetAddress address) {
        Objects.requireNonNull(address, "address");
        if (!(address instanceof Inet4Address) && !(address instanceof Inet6Address)) {
            throw AccessLogException.unsupportedAddressFamily(address.getAddress().length);
        }
        return fromRaw(anonymize(address.getAddress()));
    }

    /**
     * Masks a raw network-order address: a 4-byte IPv4 address loses its low 16 bits, a 16-byte
     * IPv6 address loses its low 80 bits. Any other length is an unsupported family.
     */
    public static byte[] anonymize(byte[] raw) {
        Objects.requireNonNull(raw, "raw");
        int kept;
        if (raw.length == IPV4_LENGTH) {
            kept = IPV4_KEPT_BYTES;
        } else if (raw.length == STORAGE_LENGTH) {
            kept = IPV6_KEPT_BYTES;
        } else {
            throw AccessLogException.unsupportedAddressFamily(raw.length);
        }
        byte[] masked = new byte[raw.length];
        System.arraycopy(raw, 0, masked, 0, kept);
        return masked;
    }

    private static InetAddress fromRaw(byte[] raw) {
        try {
            return InetAddress.getByAddress(raw);
        } catch (UnknownHostException ex) {
            throw new IllegalArgumentException("Illegal address length " + raw.length, ex);
        }
    }
}

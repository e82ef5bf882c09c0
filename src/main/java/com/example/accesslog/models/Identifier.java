package com.example.accesslog.models;

import com.example.accesslog.service.AccessLogException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import java.util.UUID;

/**
 * Opaque 128-bit identifier used for log ids and for subject/object references. The canonical
 * text form is the unpadded URL-safe base64 encoding of the 16 raw bytes; the all-zero value
 * stands for "no identifier".
 */
public final class Identifier implements Comparable<Identifier> {

    public static final int LENGTH = 16;
    public static final Identifier ZERO = new Identifier(new byte[LENGTH]);

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] bytes;

    private Identifier(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Parses the canonical text form. The empty string parses to {@link #ZERO}.
     *
     * @throws AccessLogException with code {@code INVALID_IDENTIFIER} when the text does not
     *     decode to exactly 16 bytes
     */
    @JsonCreator
    public static Identifier parse(String input) {
        Objects.requireNonNull(input, "input");
        if (input.isEmpty()) {
            return ZERO;
        }
        byte[] decoded;
        try {
            decoded = DECODER.decode(input);
        } catch (IllegalArgumentException ex) {
            throw AccessLogException.invalidIdentifier(input, ex);
        }
        if (decoded.length != LENGTH) {
            throw AccessLogException.invalidIdentifier(input);
        }
        // the decoder ignores the unused low bits of the last character
        if (!ENCODER.encodeToString(decoded).equals(stripPadding(input))) {
            throw AccessLogException.invalidIdentifier(input);
        }
        return new Identifier(decoded);
    }

    private static String stripPadding(String input) {
        int end = input.length();
        while (end > 0 && input.charAt(end - 1) == '=') {
            end--;
        }
        return input.substring(0, end);
    }

    public static Identifier fromBytes(byte[] raw) {
        Objects.requireNonNull(raw, "raw");
        if (raw.length != LENGTH) {
            throw AccessLogException.invalidIdentifier(raw.length + " bytes");
        }
        return new Identifier(raw.clone());
    }

    public static Identifier generate() {
        UUID uuid = UUID.randomUUID();
        ByteBuffer buffer = ByteBuffer.allocate(LENGTH);
        buffer.putLong(uuid.getMostSignificantBits());
        buffer.putLong(uuid.getLeastSignificantBits());
        return new Identifier(buffer.array());
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(Identifier other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Identifier)) {
            return false;
        }
        return Arrays.equals(bytes, ((Identifier) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @JsonValue
    @Override
    public String toString() {
        return ENCODER.encodeToString(bytes);
    }
}

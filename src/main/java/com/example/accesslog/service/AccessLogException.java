package com.example.accesslog.service;

import lombok.Getter;

public class AccessLogException extends RuntimeException {

    public enum Code {
        INVALID_IDENTIFIER,
        LOG_ID_COLLISION,
        UNSUPPORTED_ADDRESS_FAMILY,
        UNKNOWN
    }

    @Getter
    private final Code code;

    private AccessLogException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static AccessLogException invalidIdentifier(String input) {
        return invalidIdentifier(input, null);
    }

    public static AccessLogException invalidIdentifier(String input, Throwable cause) {
        return new AccessLogException(Code.INVALID_IDENTIFIER,
                "Identifier " + input + " is not a 128-bit identifier", cause);
    }

    public static AccessLogException logIdCollision(String logId) {
        return new AccessLogException(Code.LOG_ID_COLLISION,
                "Log ID " + logId + " already exists", null);
    }

    public static AccessLogException unsupportedAddressFamily(int addressLength) {
        return new AccessLogException(Code.UNSUPPORTED_ADDRESS_FAMILY,
                "Cannot anonymize a " + addressLength + "-byte address; only IPv4 and IPv6 are supported", null);
    }
}

package com.example.accesslog.models;

import java.net.InetAddress;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Stores a remote origin as exactly 16 bytes regardless of address family. An absent value reads
 * back as the zero-filled address.
 */
public class RemoteOriginAttributeConverter implements AttributeConverter<InetAddress> {

    public static AttributeValue toAttributeValue(InetAddress address) {
        byte[] stored = address == null
                ? new byte[RemoteOrigins.STORAGE_LENGTH]
                : RemoteOrigins.toStorageBytes(address);
        return AttributeValue.builder().b(SdkBytes.fromByteArray(stored)).build();
    }

    @Override
    public AttributeValue transformFrom(InetAddress input) {
        return toAttributeValue(input);
    }

    @Override
    public InetAddress transformTo(AttributeValue attributeValue) {
        if (attributeValue == null || attributeValue.b() == null) {
            return RemoteOrigins.UNSPECIFIED;
        }
        return RemoteOrigins.fromStorageBytes(attributeValue.b().asByteArray());
    }

    @Override
    public EnhancedType<InetAddress> type() {
        return EnhancedType.of(InetAddress.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.B;
    }
}

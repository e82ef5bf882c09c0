package com.example.accesslog.models;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

public class IdentifierAttributeConverter implements AttributeConverter<Identifier> {

    public static AttributeValue toAttributeValue(Identifier id) {
        Identifier value = id == null ? Identifier.ZERO : id;
        return AttributeValue.builder().b(SdkBytes.fromByteArray(value.toBytes())).build();
    }

    @Override
    public AttributeValue transformFrom(Identifier input) {
        return toAttributeValue(input);
    }

    @Override
    public Identifier transformTo(AttributeValue attributeValue) {
        if (attributeValue == null || attributeValue.b() == null) {
            return Identifier.ZERO;
        }
        return Identifier.fromBytes(attributeValue.b().asByteArray());
    }

    @Override
    public EnhancedType<Identifier> type() {
        return EnhancedType.of(Identifier.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.B;
    }
}

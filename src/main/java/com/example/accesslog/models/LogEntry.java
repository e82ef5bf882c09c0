package com.example.accesslog.models;

import java.net.InetAddress;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * One recorded event in the {@code access_logs} table. Only the subject/object ids and the remote
 * origin are ever rewritten after creation, and only by anonymization.
 */
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class LogEntry {

    public static final String ID = "id";
    public static final String CREATION_TIME = "creation_time";
    public static final String SCOPE = "scope";
    public static final String REMOTE_ORIGIN = "remote_origin";
    public static final String SUBJECT_ID = "subject_id";
    public static final String OBJECT_ID = "object_id";

    // required; the builder rejects nulls
    @NonNull
    private Identifier id;

    @NonNull
    private Long creationTime;     // unix seconds

    @NonNull
    private String scope;

    @NonNull
    private InetAddress remoteOrigin;

    // Optional fields, zero means "none"
    private Identifier subjectId;
    private Identifier objectId;

    // Column mapping lives on the getters; they also normalize absent values.

    @DynamoDbPartitionKey
    @DynamoDbAttribute(ID)
    @DynamoDbConvertedBy(IdentifierAttributeConverter.class)
    public Identifier getId() { return id; }

    @DynamoDbAttribute(CREATION_TIME)
    public Long getCreationTime() { return creationTime == null ? 0L : creationTime; }

    @DynamoDbAttribute(SCOPE)
    public String getScope() { return scope == null ? "" : scope; }

    @DynamoDbAttribute(REMOTE_ORIGIN)
    @DynamoDbConvertedBy(RemoteOriginAttributeConverter.class)
    public InetAddress getRemoteOrigin() { return remoteOrigin == null ? RemoteOrigins.UNSPECIFIED : remoteOrigin; }

    @DynamoDbAttribute(SUBJECT_ID)
    @DynamoDbConvertedBy(IdentifierAttributeConverter.class)
    public Identifier getSubjectId() { return subjectId == null ? Identifier.ZERO : subjectId; }

    @DynamoDbAttribute(OBJECT_ID)
    @DynamoDbConvertedBy(IdentifierAttributeConverter.class)
    public Identifier getObjectId() { return objectId == null ? Identifier.ZERO : objectId; }

    @DynamoDbIgnore
    public Instant getCreationInstant() {
        return Instant.ofEpochSecond(getCreationTime());
    }
}

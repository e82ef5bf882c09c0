package com.example.accesslog.access;

import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.IdentifierAttributeConverter;
import com.example.accesslog.models.LogEntry;
import com.example.accesslog.models.LogFilter;
import com.example.accesslog.models.RemoteOriginAttributeConverter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Translates a {@link LogFilter} into a DynamoDB filter expression. Each populated criterion
 * becomes one clause and the clauses are joined with AND; set criteria become {@code IN} lists.
 */
final class LogFilterExpressions {

    // DynamoDB caps the operand list of a single IN comparator at 100 values.
    static final int MAX_IN_OPERANDS = 100;

    private final List<String> clauses = new ArrayList<>();
    private final Map<String, String> names = new LinkedHashMap<>();
    private final Map<String, AttributeValue> values = new LinkedHashMap<>();

    private LogFilterExpressions() {
    }

    static Optional<Expression> toExpression(LogFilter filter) {
        LogFilterExpressions builder = new LogFilterExpressions();
        builder.membership(LogEntry.ID, "ids", filter.ids(), IdentifierAttributeConverter::toAttributeValue);
        if (filter.createdAfter() != null) {
            builder.comparison(LogEntry.CREATION_TIME, ">", "createdAfter", number(filter.createdAfter()));
        }
        if (filter.createdBefore() != null) {
            builder.comparison(LogEntry.CREATION_TIME, "<", "createdBefore", number(filter.createdBefore()));
        }
        builder.membership(LogEntry.SCOPE, "scopes", filter.scopes(), s -> AttributeValue.builder().s(s).build());
        builder.membership(LogEntry.REMOTE_ORIGIN, "remoteOrigins", filter.remoteOrigins(),
                RemoteOriginAttributeConverter::toAttributeValue);
        builder.membership(LogEntry.SUBJECT_ID, "subjectIds", filter.subjectIds(),
                IdentifierAttributeConverter::toAttributeValue);
        builder.membership(LogEntry.OBJECT_ID, "objectIds", filter.objectIds(),
                IdentifierAttributeConverter::toAttributeValue);
        return builder.build();
    }

    /**
     * Condition used by pruning: dated entries only, optionally older than the cutoff.
     */
    static Expression datedBefore(Long cutoff) {
        LogFilterExpressions builder = new LogFilterExpressions();
        builder.comparison(LogEntry.CREATION_TIME, "<>", "undated", number(0L));
        if (cutoff != null) {
            builder.comparison(LogEntry.CREATION_TIME, "<", "createdBefore", number(cutoff));
        }
        return builder.build().orElseThrow();
    }

    static Expression attributeEquals(String attribute, Identifier value) {
        LogFilterExpressions builder = new LogFilterExpressions();
        builder.comparison(attribute, "=", "match", IdentifierAttributeConverter.toAttributeValue(value));
        return builder.build().orElseThrow();
    }

    static AttributeValue number(long value) {
        return AttributeValue.builder().n(Long.toString(value)).build();
    }

    private void comparison(String attribute, String operator, String placeholder, AttributeValue value) {
        String name = name(attribute);
        String token = ":" + placeholder;
        values.put(token, value);
        clauses.add(name + " " + operator + " " + token);
    }

    private <T> void membership(String attribute, String placeholder, Collection<T> candidates,
                                Function<T, AttributeValue> toValue) {
        if (candidates.isEmpty()) {
            return;
        }
        String name = name(attribute);
        List<String> groups = new ArrayList<>();
        List<String> tokens = new ArrayList<>();
        int i = 0;
        for (T candidate : candidates) {
            String token = ":" + placeholder + i++;
            values.put(token, toValue.apply(candidate));
            tokens.add(token);
            if (tokens.size() == MAX_IN_OPERANDS) {
                groups.add(name + " IN (" + String.join(", ", tokens) + ")");
                tokens.clear();
            }
        }
        if (!tokens.isEmpty()) {
            groups.add(name + " IN (" + String.join(", ", tokens) + ")");
        }
        clauses.add(groups.size() == 1 ? groups.get(0) : "(" + String.join(" OR ", groups) + ")");
    }

    private String name(String attribute) {
        String name = "#" + attribute.replace("_", "");
        names.put(name, attribute);
        return name;
    }

    private Optional<Expression> build() {
        if (clauses.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Expression.builder()
                .expression(String.join(" AND ", clauses))
                .expressionNames(names)
                .expressionValues(values)
                .build());
    }
}

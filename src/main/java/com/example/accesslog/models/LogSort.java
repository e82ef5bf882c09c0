package com.example.accesslog.models;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * Sort applied to search results. Sorting by creation time breaks ties by id, so every sort is a
 * total order and descending is always the exact reverse of ascending.
 */
public record LogSort(Field field, Order order) {

    public enum Field {
        CREATION_TIME(LogEntry.CREATION_TIME),
        ID(LogEntry.ID);

        private final String column;

        Field(String column) {
            this.column = column;
        }

        public String column() {
            return column;
        }

        public static Field fromColumn(String column) {
            for (Field f : values()) {
                if (f.column.equals(column)) {
                    return f;
                }
            }
            throw new IllegalArgumentException("Unsupported sort field: " + column);
        }
    }

    public enum Order {
        ASC,
        DESC;

        public static Order fromString(String v) {
            try {
                return valueOf(v.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported sort order: " + v, ex);
            }
        }
    }

    public LogSort {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(order, "order");
    }

    public static LogSort defaults() {
        return new LogSort(Field.CREATION_TIME, Order.ASC);
    }

    /**
     * Resolves request-style sort parameters; blank values fall back to the defaults.
     */
    public static LogSort of(String sort, String order) {
        Field field = isBlank(sort) ? Field.CREATION_TIME : Field.fromColumn(sort.trim());
        Order direction = isBlank(order) ? Order.ASC : Order.fromString(order);
        return new LogSort(field, direction);
    }

    public Comparator<LogEntry> comparator() {
        Comparator<LogEntry> byId = Comparator.comparing(LogEntry::getId);
        Comparator<LogEntry> ascending = field == Field.ID
                ? byId
                : Comparator.comparingLong(LogEntry::getCreationTime).thenComparing(byId);
        return order == Order.ASC ? ascending : ascending.reversed();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

package io.github.crudgraph.core.enums;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public enum AttributeType {
    STRING,
    INTEGER,
    BIGINT,
    DECIMAL,
    BOOLEAN,
    DATE,
    DATETIME;

    /**
     * Converts a raw request value (path variable, header) to the Java type stored for this attribute.
     */
    public Object convert(String raw) {
        if (raw == null) {
            return null;
        }
        switch (this) {
            case INTEGER:
                return Integer.valueOf(raw.trim());
            case BIGINT:
                return Long.valueOf(raw.trim());
            case DECIMAL:
                return new BigDecimal(raw.trim());
            case BOOLEAN:
                return Boolean.valueOf(raw.trim());
            case DATE:
                return LocalDate.parse(raw.trim());
            case DATETIME:
                return LocalDateTime.parse(raw.trim());
            default:
                return raw;
        }
    }
}

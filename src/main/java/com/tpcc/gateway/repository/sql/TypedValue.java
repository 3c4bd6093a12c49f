package com.tpcc.gateway.repository.sql;

import java.util.Objects;

/**
 * A value ready to be bound, paired with its backend type.
 *
 * @param value backend-acceptable representation (may be null)
 * @param type inferred type tag
 */
public record TypedValue(Object value, ParamType type) {

    public TypedValue {
        Objects.requireNonNull(type, "type");
    }

    public boolean isNull() {
        return value == null;
    }
}

package com.tpcc.gateway.repository.sql;

/**
 * Backend-native parameter types a bound value can carry.
 *
 * NUMERIC is used for exact decimals (money columns); the remaining tags
 * mirror the scalar types every supported backend accepts.
 */
public enum ParamType {
    STRING,
    BOOL,
    INT64,
    FLOAT64,
    NUMERIC,
    TIMESTAMP
}

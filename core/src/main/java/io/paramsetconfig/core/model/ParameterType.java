package io.paramsetconfig.core.model;

/** Type tag of a paramset parameter as reported by the device description. */
public enum ParameterType {
    BOOL,
    INTEGER,
    FLOAT,
    ENUM,
    STRING,
    ACTION
}

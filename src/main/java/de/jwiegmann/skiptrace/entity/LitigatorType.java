package de.jwiegmann.skiptrace.entity;

public enum LitigatorType {
    LITIGATOR,
    SERIAL_LITIGATOR,
    PRE_LITIGATOR,
    COMPLAINER,
    ASSOCIATED
}

package org.qed.algebra;

/**
 * Discriminant of every node kind. The declaration order is the cross-kind part of the total order on
 * {@link Basic}: nodes of different kinds compare by the ordinal of their type id.
 */
public enum TypeID {
    INTEGER,
    RATIONAL,
    SYMBOL,
    ADD,
    MUL,
    POW,
    SIN,
    COS,
    FUNCTION_SYMBOL,
    DERIVATIVE
}

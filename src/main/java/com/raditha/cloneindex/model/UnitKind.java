package com.raditha.cloneindex.model;

/**
 * Kind of code unit produced by a structural extractor.
 */
public enum UnitKind {
    /** Method, constructor or free function */
    FUNCTION,

    /** Class, interface, enum or record declaration */
    CLASS,

    /** Whole compilation unit / module */
    MODULE
}

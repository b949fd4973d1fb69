package com.tfmigrate.transform.scan;

/**
 * Kind of value an array element holds, as far as its tokens reveal it.
 */
public enum ElementType {
    STRING,
    NUMBER,
    BOOL,
    OBJECT,
    /** Variable, resource or function reference; any bare identifier other than true/false. */
    REFERENCE,
    /** Quoted string containing an interpolation. */
    TEMPLATE,
    UNKNOWN
}

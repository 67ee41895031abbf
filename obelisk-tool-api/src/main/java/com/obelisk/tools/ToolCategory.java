package com.obelisk.tools;

/**
 * Category for tool discovery and grouping.
 */
public enum ToolCategory {

    /** Arithmetic and unit conversion (e.g. calculator). */
    MATH,

    /** Lookups against external information sources (e.g. weather). */
    INFORMATION,

    /** Search and retrieval. */
    RESEARCH,

    /** Code generation or execution. */
    CODE,

    /** Data and analytics. */
    DATA,

    /** Other / custom. */
    OTHER
}

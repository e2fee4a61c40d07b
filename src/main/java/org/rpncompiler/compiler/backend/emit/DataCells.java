package org.rpncompiler.compiler.backend.emit;

/**
 * Names of the fixed cells in the data section of every generated program.
 */
public final class DataCells {

    /** Scratch cell for the first (topmost) operand and for results. */
    public static final String OP_A = "op_a";
    /** Scratch cell for the second operand. */
    public static final String OP_B = "op_b";
    /** Number of values currently on the evaluation stack. */
    public static final String DEPTH = "depth";
    /** Integer conversion cell used for truncation and for loading integer results. */
    public static final String TRUNC = "trunc";
    /** Format string for the final result. */
    public static final String RESULT_FORMAT = "fmt";

    private DataCells() {}
}

package org.rpncompiler.compiler.ir;

/**
 * The closed set of operations an RPN program is lowered to.
 * <p>
 * Each opcode records its run-time stack effect: how many values must be on the
 * evaluation stack before it executes, and how the depth changes afterwards.
 */
public enum IrOpcode {
    /** Pushes a constant. */
    PUSH(0, +1),
    /** Pops two values, pushes their sum. */
    PLUS(2, -1),
    /** Pops two values, pushes the second minus the top. */
    MINUS(2, -1),
    /** Pops two values, pushes their product. */
    MULTIPLY(2, -1),
    /** Pops two values, pushes the second divided by the top. */
    DIVIDE(2, -1),
    /** Pops two values, pushes the integer remainder. */
    MODULUS(2, -1),
    /** Pops exponent and base, pushes the integer power. */
    POWER(2, -1),
    /** Replaces the top value with its absolute value. */
    ABS(1, 0),
    /** Replaces the top value with its sine. */
    SIN(1, 0),
    /** Replaces the top value with its cosine. */
    COS(1, 0),
    /** Replaces the top value with its tangent. */
    TAN(1, 0),
    /** Replaces the top value with its square root. */
    SQRT(1, 0),
    /** Duplicates the top value. */
    DUP(1, +1),
    /** Exchanges the two topmost values. */
    SWAP(2, 0),
    /** Replaces the top value with its integer factorial. */
    FACTORIAL(1, 0);

    private final int requiredDepth;
    private final int depthDelta;

    IrOpcode(int requiredDepth, int depthDelta) {
        this.requiredDepth = requiredDepth;
        this.depthDelta = depthDelta;
    }

    /**
     * @return The minimum number of values that must be on the stack before execution.
     */
    public int requiredDepth() {
        return requiredDepth;
    }

    /**
     * @return The net change in stack depth after execution.
     */
    public int depthDelta() {
        return depthDelta;
    }
}

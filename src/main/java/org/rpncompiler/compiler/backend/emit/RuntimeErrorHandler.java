package org.rpncompiler.compiler.backend.emit;

/**
 * The shared run-time error exits of a generated program. Each loads its message and
 * continues at {@link #PRINT_AND_EXIT}, which prints it and terminates the process.
 * None of them resumes normal execution.
 */
public enum RuntimeErrorHandler {
    DIVISION_BY_ZERO("division_by_zero", "div_zero", "Attempted division by zero.  Aborting"),
    REGISTER_OVERFLOW("register_overflow", "overflow", "Overflow - value out of range.  Aborting"),
    STACK_TOO_FULL("stack_too_full", "stack_full", "Too many entries remaining on the stack.  Aborting"),
    // Last, so it falls through into the print routine.
    STACK_UNDERFLOW("stack_error", "stack_err", "Insufficient entries on the stack.  Aborting");

    /** Label of the routine that prints the message in {@code rdi} and exits. */
    public static final String PRINT_AND_EXIT = "print_msg_and_exit";

    private final String label;
    private final String messageSymbol;
    private final String message;

    RuntimeErrorHandler(String label, String messageSymbol, String message) {
        this.label = label;
        this.messageSymbol = messageSymbol;
        this.message = message;
    }

    /**
     * @return The jump target of this handler.
     */
    public String label() {
        return label;
    }

    public String messageSymbol() {
        return messageSymbol;
    }

    /**
     * @return The message printed by the generated program, without trailing newline.
     */
    public String message() {
        return message;
    }
}

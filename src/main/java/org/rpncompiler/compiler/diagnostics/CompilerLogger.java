package org.rpncompiler.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress logging for the compiler phases, filtered by an integer verbosity on top of
 * the SLF4J level of the {@code org.rpncompiler.compiler} logger.
 * <p>
 * Verbosity: 0 quiet, 1 normal, 2 verbose (phase progress), 3 trace (IR dumps).
 * Messages use SLF4J placeholders.
 */
public final class CompilerLogger {

    public static final int QUIET = 0;
    public static final int NORMAL = 1;
    public static final int VERBOSE = 2;
    public static final int TRACE = 3;

    private static final Logger LOG = LoggerFactory.getLogger("org.rpncompiler.compiler");

    private static volatile int verbosity = NORMAL;

    private CompilerLogger() {}

    /**
     * Sets the verbosity; values outside {@link #QUIET}..{@link #TRACE} are clamped.
     * @param level The new verbosity.
     */
    public static void setVerbosity(int level) {
        verbosity = Math.max(QUIET, Math.min(TRACE, level));
    }

    public static int verbosity() {
        return verbosity;
    }

    /**
     * Logs the completion of a compiler phase.
     * @param programName The program being compiled.
     * @param phase The phase name, e.g. {@code lex}.
     * @param format Details, with SLF4J placeholders.
     * @param args The placeholder values.
     */
    public static void phase(String programName, String phase, String format, Object... args) {
        if (verbosity >= VERBOSE && LOG.isDebugEnabled()) {
            LOG.debug("[" + programName + "] " + phase + ": " + format, args);
        }
    }

    public static void trace(String format, Object... args) {
        if (verbosity >= TRACE) LOG.trace(format, args);
    }
}

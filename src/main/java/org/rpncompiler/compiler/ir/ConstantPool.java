package org.rpncompiler.compiler.ir;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The distinct numeric literals a program references, keyed by literal text
 * ("3" and "3.0" are different entries). Iteration follows first-use order so
 * the emitted data section is reproducible.
 */
public final class ConstantPool {

    private final Set<String> literals = new LinkedHashSet<>();

    /**
     * Records a literal; a literal already in the pool keeps its position.
     * @param literal The literal text.
     */
    public void add(String literal) {
        literals.add(literal);
    }

    /**
     * @return An immutable snapshot of the literals in first-use order.
     */
    public List<String> literals() {
        return List.copyOf(literals);
    }
}

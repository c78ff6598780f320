package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.Expression;

import java.util.List;

/**
 * The classification of the value of an assignment {@code x = e}, which determines the column of {@code x} in
 * the relation of the assignment. See {@link ClassifyExpression}.
 */
public sealed interface RightHandSide {

    // x = x, x = +x
    record NoOp() implements RightHandSide {
    }

    // no variables: x = 3, x = !y, x = sizeof y, x = (y < z)
    record Constant() implements RightHandSide {
    }

    // x = y, with y != x
    record Copy(String source) implements RightHandSide {
    }

    // exactly one variable occurrence, all other operands constant: x = y + 1, x = -y, x = 2 * y
    record Linear(String variable) implements RightHandSide {
    }

    // two or more variable occurrences under + and -; duplicates kept, in order of occurrence
    record Additive(List<String> occurrences) implements RightHandSide {
        public Additive {
            occurrences = List.copyOf(occurrences);
            assert occurrences.size() >= 2;
        }
    }

    // two or more variable occurrences under *
    record Multiplicative(List<String> occurrences) implements RightHandSide {
        public Multiplicative {
            occurrences = List.copyOf(occurrences);
            assert occurrences.size() >= 2;
        }
    }

    // x = f(a, b, 3); arguments are variable names, or null for constants
    record Call(String function, List<String> arguments) implements RightHandSide {
    }

    record Unsupported(Expression expression, String reason) implements RightHandSide {
    }

    default boolean isSupported() {
        return !(this instanceof Unsupported);
    }
}

package org.e2immu.analyzer.mwp.prepwork;

import java.util.Objects;

/**
 * A message about a statement that the analysis could not, or only partially, take into account.
 *
 * @param index   the statement index, see {@link StatementIndex}
 * @param source  a compact rendering of the statement
 * @param message the reason
 */
public record Diagnostic(String index, String source, String message) {

    public Diagnostic {
        Objects.requireNonNull(index);
        Objects.requireNonNull(message);
    }

    @Override
    public String toString() {
        return index + ": " + message + " [" + source + "]";
    }
}

package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.Block;
import org.e2immu.analyzer.mwp.common.cst.Statement;

import java.util.List;
import java.util.function.BiConsumer;

/*
Statement indices are dotted strings: the top-level statements of a function body are 0, 1, 2, ...
The statements of the n-th sub-block of statement 3 are 3.n.0, 3.n.1, ...
For an if-else statement, sub-block 0 is the if-branch and 1 is the else-branch.
For a for-statement, the sub-blocks are, in order, initializer (when present), body and updater (when present).
 */
public class StatementIndex {

    public static final char DOT = '.';
    public static final String FIRST = "0";

    private StatementIndex() {
    }

    public static String top(int statement) {
        return Integer.toString(statement);
    }

    public static String sub(String parent, int block, int statement) {
        return parent + DOT + block + DOT + statement;
    }

    public static int depth(String index) {
        int count = 0;
        for (int i = 0; i < index.length(); i++) {
            if (index.charAt(i) == DOT) ++count;
        }
        return count / 2;
    }

    public static String parent(String index) {
        int last = index.lastIndexOf(DOT);
        if (last < 0) return null;
        int secondLast = index.lastIndexOf(DOT, last - 1);
        assert secondLast > 0 : "Malformed index " + index;
        return index.substring(0, secondLast);
    }

    /**
     * @param scope an index designating a statement
     * @param index an index
     * @return true when the statement at index is nested in the statement at scope, or is that statement
     */
    public static boolean inScopeOf(String scope, String index) {
        return index.equals(scope) || index.startsWith(scope + DOT);
    }

    /**
     * Visits every statement nested in the block, depth first, together with its index.
     * The block passed in is not visited itself.
     */
    public static void walk(Block block, BiConsumer<String, Statement> visitor) {
        for (int i = 0; i < block.size(); i++) {
            walk(top(i), block.statements().get(i), visitor);
        }
    }

    private static void walk(String index, Statement statement, BiConsumer<String, Statement> visitor) {
        visitor.accept(index, statement);
        List<Statement> subs = statement instanceof Block ? List.of(statement) : statement.subStatements();
        for (int block = 0; block < subs.size(); block++) {
            Statement sub = subs.get(block);
            if (sub instanceof Block b) {
                for (int i = 0; i < b.size(); i++) {
                    walk(sub(index, block, i), b.statements().get(i), visitor);
                }
            } else {
                walk(sub(index, block, 0), sub, visitor);
            }
        }
    }
}

package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.Block;
import org.e2immu.analyzer.mwp.common.cst.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the loops of a function body, in source order. Nested loops are lifted: a loop nested in another one
 * occurs in the list after the enclosing loop, which still contains it.
 */
public class FindLoops {

    public record Loop(String index, Statement statement) {
        public Loop {
            assert statement.isLoop();
        }

        @Override
        public String toString() {
            return index + ": " + statement;
        }
    }

    private FindLoops() {
    }

    public static List<Loop> in(Block body) {
        List<Loop> loops = new ArrayList<>();
        StatementIndex.walk(body, (index, statement) -> {
            if (statement.isLoop()) loops.add(new Loop(index, statement));
        });
        return List.copyOf(loops);
    }
}

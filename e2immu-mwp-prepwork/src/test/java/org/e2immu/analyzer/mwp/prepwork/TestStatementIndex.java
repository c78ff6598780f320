package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.Block;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.e2immu.analyzer.mwp.common.cst.CstFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestStatementIndex {

    @Test
    public void test1() {
        assertEquals("3.1.0", StatementIndex.sub("3", 1, 0));
        assertEquals(0, StatementIndex.depth("3"));
        assertEquals(2, StatementIndex.depth("3.1.0.0.2"));
        assertEquals("3", StatementIndex.parent("3.1.0"));
        assertEquals("3.1.0", StatementIndex.parent("3.1.0.0.2"));
        assertNull(StatementIndex.parent("3"));
        assertTrue(StatementIndex.inScopeOf("3", "3.1.0"));
        assertTrue(StatementIndex.inScopeOf("3", "3"));
        assertFalse(StatementIndex.inScopeOf("3", "30.1.0"));
    }

    @Test
    public void test2() {
        Block body = block(assign("x", constant(0)),
                ifThenElse(less(var("x"), var("y")), block(assign("x", var("y"))), assign("y", var("x"))),
                countedLoop("i", "n", increment("x")));
        List<String> indices = new ArrayList<>();
        StatementIndex.walk(body, (index, statement) -> indices.add(index));
        assertEquals("[0, 1, 1.0.0, 1.1.0, 2, 2.0.0, 2.1.0, 2.2.0]", indices.toString());
    }
}

package org.e2immu.analyzer.mwp.prepwork;

import org.e2immu.analyzer.mwp.common.cst.FunctionDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.e2immu.analyzer.mwp.common.cst.CstFactory.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestPrepAnalyzer extends CommonTest {

    private final FunctionDefinition f = function("f", List.of("a"),
            assign("b", var("a")),
            unsupported("switch", "switch (a) { }", "a"),
            assign("c", plus(var("a"), var("b"))));

    @Test
    public void test1() {
        PreparedFunction pf = new PrepAnalyzer().doFunction(f);
        assertTrue(pf.analyzable());
        assertEquals("f", pf.name());
        assertEquals("[a, b, c]", pf.variables().toString());
        assertEquals(1, pf.diagnostics().size());
        assertEquals("{ b = a; c = a + b; }", pf.body().toString());
    }

    @Test
    public void testStrict() {
        PrepAnalyzer prepAnalyzer = new PrepAnalyzer(new PrepAnalyzer.Options.Builder().setStrict(true).build());
        PreparedFunction pf = prepAnalyzer.doFunction(f);
        assertFalse(pf.analyzable());
        assertEquals("1", pf.diagnostics().get(0).index());
        assertSame(f.body(), pf.body());
    }
}

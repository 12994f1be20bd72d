/*++
 Copyright (c) 2012 Microsoft Corporation

Module Name:

    ExprsTest.java

Abstract:

    Formula construction, printing and the syntactic utilities.

--*/

package org.updr;

import static org.junit.Assert.*;
import static org.updr.Exprs.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;
import org.updr.enumerations.ExprKind;

public class ExprsTest
{
    private final Program m_program = Protocols.lock();
    private final Sort m_node = m_program.getSort("node");

    @Test
    public void testBuildersCollapseTrivialCases()
    {
        assertEquals(TRUE, and());
        assertEquals(FALSE, or());
        assertEquals(id("p"), and(id("p")));
        assertEquals(id("p"), app("p"));
        assertEquals(ExprKind.ID, app("p").getKind());
        Expr body = app("holds", id("X"));
        assertSame(body, forall(Collections.<SortedVar>emptyList(), body));
    }

    @Test
    public void testPrinting()
    {
        Expr e = and(or(id("a"), id("b")), not(app("holds", id("X"))));
        assertEquals("(a | b) & !holds(X)", e.toString());
        SortedVar x = new SortedVar("X", m_node);
        assertEquals("forall X:node. holds(X)", forall(x, app("holds", id("X"))).toString());
        assertEquals("old(unlocked)", old(id("unlocked")).toString());
    }

    @Test
    public void testStructuralEquality()
    {
        Expr a = implies(app("holds", id("X")), eq(id("X"), id("Y")));
        Expr b = implies(app("holds", id("X")), eq(id("X"), id("Y")));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, implies(app("holds", id("Y")), eq(id("X"), id("Y"))));
    }

    @Test
    public void testNegate()
    {
        assertEquals(neq(id("X"), id("Y")), negate(eq(id("X"), id("Y"))));
        assertEquals(eq(id("X"), id("Y")), negate(neq(id("X"), id("Y"))));
        assertEquals(app("holds", id("X")), negate(not(app("holds", id("X")))));
        assertEquals(FALSE, negate(TRUE));
        assertEquals(not(id("unlocked")), negate(id("unlocked")));
    }

    @Test
    public void testConjunctsFlatten()
    {
        Expr e = and(id("a"), and(id("b"), TRUE, id("c")), or(id("d"), id("e")));
        assertEquals(Arrays.asList(id("a"), id("b"), id("c"), or(id("d"), id("e"))), conjuncts(e));
        assertTrue(conjuncts(TRUE).isEmpty());
    }

    @Test
    public void testSubstituteRespectsBinders()
    {
        SortedVar x = new SortedVar("X", m_node);
        Expr e = and(app("holds", id("X")), forall(x, app("holds", id("X"))));
        Map<String, Expr> subst = new HashMap<String, Expr>();
        subst.put("X", id("Y"));
        Expr r = substitute(e, subst);
        assertEquals(and(app("holds", id("Y")), forall(x, app("holds", id("X")))), r);
    }

    @Test
    public void testFreeIds()
    {
        SortedVar x = new SortedVar("X", m_node);
        Expr e = and(forall(x, app("holds", id("X"))), eq(id("Y"), id("Z")));
        assertEquals(Arrays.asList("holds", "Y", "Z"), Arrays.asList(freeIds(e).toArray()));
    }
}

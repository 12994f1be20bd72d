/*++
 Copyright (c) 2012 Microsoft Corporation

Module Name:

    DiagramTest.java

Abstract:

    Diagrams of concrete states: satisfaction by the state they come from,
    constant simplification and literal bookkeeping.

--*/

package org.updr;

import static org.junit.Assert.*;
import static org.updr.Exprs.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.updr.enumerations.DiagramGroupKind;
import org.updr.enumerations.ExprKind;

public class DiagramTest
{
    private Program m_program;
    private SolverSession m_session;
    private Trace m_state;

    @Before
    public void setUp()
    {
        m_program = Protocols.token();
        m_session = new SolverSession(m_program, UpdrConfig.defaults());
        // a state with two tokens
        m_state = Logic.checkImplication(m_session, Collections.<Expr>emptyList(), m_program.getSafeties());
        assertNotNull(m_state);
    }

    @After
    public void tearDown()
    {
        m_session.close();
    }

    @Test
    public void testStateSatisfiesItsDiagram()
    {
        Diagram d = m_state.asDiagram(0, false);
        assertTrue(m_state.eval(d.toExpr(), 0));
        assertFalse(m_state.eval(d.toPredicate(), 0));
        assertEquals(m_state.getUniverse(m_program.getSort("node")).size(), d.getVars().size());
    }

    @Test
    public void testGroups()
    {
        Diagram d = m_state.asDiagram(0, false);
        Map<Diagram.Group, List<Integer>> groups = d.groups();
        List<DiagramGroupKind> kinds = new ArrayList<DiagramGroupKind>();
        for (Diagram.Group g : groups.keySet())
            kinds.add(g.getKind());
        assertTrue(kinds.contains(DiagramGroupKind.INEQUALITY));
        assertTrue(kinds.contains(DiagramGroupKind.RELATION));
        assertTrue(kinds.contains(DiagramGroupKind.CONSTANT));
        assertTrue(kinds.contains(DiagramGroupKind.FUNCTION));
        int total = 0;
        for (List<Integer> l : groups.values())
            total += l.size();
        assertEquals(d.size(), total);
    }

    @Test
    public void testSimplifyConstsDropsVariables()
    {
        Diagram plain = m_state.asDiagram(0, false);
        Diagram simple = m_state.asDiagram(0, true);
        assertTrue(simple.getVars().size() < plain.getVars().size());
        assertTrue(m_state.eval(simple.toExpr(), 0));
        assertFalse(m_state.eval(simple.toPredicate(), 0));
        for (Expr c : simple.activeConjuncts())
            assertFalse(c.toString(), c.getKind() == ExprKind.EQ
                    && ((BinaryExpr) c).getLeft().equals(((BinaryExpr) c).getRight()));
    }

    @Test(expected = IllegalStateException.class)
    public void testSimplifyAfterRemoval()
    {
        Diagram d = m_state.asDiagram(0, false);
        d.remove(Collections.singletonList(0));
        d.simplifyConsts();
    }

    @Test
    public void testRemoveAndRestore()
    {
        Diagram d = m_state.asDiagram(0, false);
        int size = d.size();
        List<Integer> relation = null;
        for (Map.Entry<Diagram.Group, List<Integer>> e : d.groups().entrySet())
            if (e.getKey().getKind() == DiagramGroupKind.RELATION)
                relation = e.getValue();
        assertNotNull(relation);
        d.remove(relation);
        assertEquals(size - relation.size(), d.size());
        assertFalse(d.isActive(relation.get(0)));
        assertEquals(size, d.capacity());
        d.restore(relation);
        assertEquals(size, d.size());
        assertTrue(d.isActive(relation.get(0)));
    }

    @Test
    public void testRetainOnlyAndPrune()
    {
        Diagram d = m_state.asDiagram(0, false);
        List<Integer> positive = new ArrayList<Integer>();
        for (int i : d.activeIndices())
            if (d.isPositive(i))
                positive.add(i);
        // two nodes hold a token
        assertEquals(2, positive.size());
        d.retainOnly(positive.subList(0, 1));
        d.pruneUnusedVars();
        assertEquals(1, d.size());
        assertEquals(1, d.getVars().size());
        assertEquals(d.getConjunct(positive.get(0)), ((QuantifierExpr) d.toExpr()).getBody());
    }

    @Test
    public void testCopyIsIndependent()
    {
        Diagram d = m_state.asDiagram(0, false);
        Diagram c = d.copy();
        c.remove(c.activeIndices());
        assertEquals(0, c.size());
        assertEquals(FALSE, c.toPredicate());
        assertTrue(d.size() > 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonLiteral()
    {
        SortedVar x = new SortedVar("X", m_program.getSort("node"));
        new Diagram(m_program, Collections.singletonList(x),
                Collections.singletonList(or(app("has_token", id("X")), not(app("has_token", id("X"))))));
    }

    @Test
    public void testElementNamesAvoidDeclaredNames()
    {
        Program.Builder b = Program.builder();
        Sort lower = b.declareSort("a");
        Sort upper = b.declareSort("A");
        Sort node = b.declareSort("node");
        b.declareConstant("NODE0", false, node);
        b.declareConstant("c", true, lower);
        b.declareConstant("d", true, upper);
        b.declareRelation("r", true, node);
        b.addInit(TRUE);
        b.addSafety(TRUE);
        Program p = b.build();

        SortedVar x = new SortedVar("X", node);
        Expr oneNode = forall(x, eq(id("X"), id("NODE0")));
        try (SolverSession s = new SolverSession(p, UpdrConfig.defaults()))
        {
            Trace t = Logic.checkImplication(s, Collections.<Expr>emptyList(), Collections.singletonList(oneNode));
            assertNotNull(t);
            assertEquals(2, t.getUniverse(node).size());

            Set<String> names = new HashSet<String>();
            for (Sort sort : p.getSorts())
                for (String e : t.getUniverse(sort))
                {
                    assertTrue("duplicate element " + e, names.add(e));
                    assertNull(e, p.getSymbol(e));
                    assertNull(e, p.getSort(e));
                }
            assertFalse(names.contains("NODE0"));

            for (boolean simplify : new boolean[] { false, true })
            {
                Diagram d = t.asDiagram(0, simplify);
                assertTrue(d.toString(), t.eval(d.toExpr(), 0));
                assertFalse(d.toString(), t.eval(d.toPredicate(), 0));
            }
            Diagram simplified = t.asDiagram(0, true);
            assertEquals(1, simplified.getVars().size());
        }
    }
}

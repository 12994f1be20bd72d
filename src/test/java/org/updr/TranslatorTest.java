/*++
 Copyright (c) 2012 Microsoft Corporation

Module Name:

    TranslatorTest.java

Abstract:

    Translation of formulas and transitions into Z3 terms over state keys.

--*/

package org.updr;

import static org.junit.Assert.*;
import static org.updr.Exprs.*;

import java.util.Collections;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.microsoft.z3.Status;

public class TranslatorTest
{
    private SolverSession m_session;

    private static Program twoRelations()
    {
        Program.Builder b = Program.builder();
        Sort node = b.declareSort("node");
        b.declareRelation("p", true, node);
        b.declareRelation("q", true, node);
        b.addInit(TRUE);
        SortedVar n = new SortedVar("N", node);
        b.addTransition("set_p", Collections.singletonList(n), app("p", id("N")), "p");
        b.addSafety(TRUE);
        return b.build();
    }

    @Before
    public void setUp()
    {
        m_session = new SolverSession(twoRelations(), UpdrConfig.defaults());
    }

    @After
    public void tearDown()
    {
        m_session.close();
    }

    private Status check(Expr formula, int index, String... keys)
    {
        try (SolverSession.Scope scope = m_session.newScope())
        {
            Translator t = m_session.getTranslator(keys);
            m_session.add(t.translateTransitions(1));
            m_session.add(t.translate(formula, index));
            return m_session.check("test");
        }
    }

    @Test
    public void testUnmodifiedSymbolKeepsItsValue()
    {
        SortedVar x = new SortedVar("X", m_session.getProgram().getSort("node"));
        Expr changed = exists(x, and(old(app("q", id("X"))), not(app("q", id("X")))));
        assertEquals(Status.UNSATISFIABLE, check(changed, 1, SolverSession.OLD, SolverSession.NEW));
    }

    @Test
    public void testModifiedSymbolMayChange()
    {
        SortedVar x = new SortedVar("X", m_session.getProgram().getSort("node"));
        Expr changed = exists(x, and(not(old(app("p", id("X")))), app("p", id("X"))));
        assertEquals(Status.SATISFIABLE, check(changed, 1, SolverSession.OLD, SolverSession.NEW));
    }

    @Test
    public void testTransitionConstrainsPostState()
    {
        SortedVar x = new SortedVar("X", m_session.getProgram().getSort("node"));
        Expr noneSet = forall(x, not(app("p", id("X"))));
        assertEquals(Status.UNSATISFIABLE, check(noneSet, 1, SolverSession.OLD, SolverSession.NEW));
    }

    @Test
    public void testKeysAreIndependent()
    {
        SortedVar x = new SortedVar("X", m_session.getProgram().getSort("node"));
        try (SolverSession.Scope scope = m_session.newScope())
        {
            Translator t = m_session.getTranslator("a", "b");
            m_session.add(t.translate(forall(x, app("q", id("X"))), 0));
            m_session.add(t.translate(forall(x, not(app("q", id("X")))), 1));
            assertEquals(Status.SATISFIABLE, m_session.check("independent keys"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testOldAtFirstKey()
    {
        SortedVar x = new SortedVar("X", m_session.getProgram().getSort("node"));
        Translator t = m_session.getTranslator(SolverSession.ONE);
        t.translate(forall(x, old(app("q", id("X")))), 0);
    }

    @Test
    public void testDerivedRelationAxiomPerKey()
    {
        try (SolverSession s = new SolverSession(Protocols.lock(), UpdrConfig.defaults()))
        {
            for (int index = 0; index < 2; index++)
            {
                try (SolverSession.Scope scope = s.newScope())
                {
                    Translator t = s.getTranslator(SolverSession.OLD, SolverSession.NEW);
                    s.add(t.translate(and(id("unlocked"), id("locked")), index));
                    assertEquals(Status.UNSATISFIABLE, s.check("locked and unlocked at " + index));
                }
            }
        }
    }

    @Test
    public void testImmutableSymbolsAreShared()
    {
        try (SolverSession s = new SolverSession(Protocols.token(), UpdrConfig.defaults()))
        {
            Translator t = s.getTranslator(SolverSession.OLD, SolverSession.NEW);
            s.add(t.translate(eq(app("next", id("leader")), id("leader")), 0));
            s.add(t.translate(neq(app("next", id("leader")), id("leader")), 1));
            assertEquals(Status.UNSATISFIABLE, s.check("shared immutables"));
        }
    }

    @Test
    public void testBooleanEqualityIsIff()
    {
        try (SolverSession s = new SolverSession(Protocols.lock(), UpdrConfig.defaults()))
        {
            Translator t = s.getTranslator(SolverSession.ONE);
            s.add(t.translate(eq(id("unlocked"), id("locked")), 0));
            assertEquals(Status.UNSATISFIABLE, s.check("unlocked = locked"));
        }
    }
}

/*++
 Copyright (c) 2012 Microsoft Corporation

Module Name:

    LogicTest.java

Abstract:

    Implication, inductiveness and bounded reachability queries.

--*/

package org.updr;

import static org.junit.Assert.*;
import static org.updr.Exprs.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class LogicTest
{
    @Test
    public void testInitiation()
    {
        Program p = Protocols.lock();
        try (SolverSession s = new SolverSession(p, UpdrConfig.defaults()))
        {
            assertNull(Logic.checkInitiation(s, p.getSafeties()));
        }
    }

    @Test
    public void testSafetyAloneIsNotInductive()
    {
        Program p = Protocols.lock();
        Expr mutex = p.getSafety();
        try (SolverSession s = new SolverSession(p, UpdrConfig.defaults()))
        {
            Trace cti = Logic.checkInductive(s, p.getSafeties());
            assertNotNull(cti);
            assertEquals(2, cti.getNumStates());
            assertEquals(Collections.singletonList("acquire"), cti.getTransitions());
            assertTrue(cti.eval(mutex, 0));
            assertFalse(cti.eval(mutex, 1));
            assertTrue(cti.eval(id("unlocked"), 0));
            // two nodes are needed to violate mutual exclusion
            assertEquals(2, cti.getUniverse(p.getSort("node")).size());
        }
    }

    @Test
    public void testStrengthenedInvariantIsInductive()
    {
        Program p = Protocols.lock();
        List<Expr> invariant = Arrays.asList(p.getSafety(), Protocols.free(p.getSort("node")));
        try (SolverSession s = new SolverSession(p, UpdrConfig.defaults()))
        {
            assertNull(Logic.checkInductive(s, invariant));
        }
    }

    @Test
    public void testBoundedViolation()
    {
        Program p = Protocols.unguardedLock();
        try (SolverSession s = new SolverSession(p, UpdrConfig.defaults()))
        {
            Trace t = Logic.checkBounded(s, p.getSafety(), 3);
            assertNotNull(t);
            assertEquals(3, t.getNumStates());
            assertEquals(Arrays.asList("acquire", "acquire"), t.getTransitions());
            for (Expr init : p.getInits())
                assertTrue(t.eval(init, 0));
            assertFalse(t.eval(p.getSafety(), 2));
        }
    }

    @Test
    public void testBoundedSafety()
    {
        Program p = Protocols.lock();
        try (SolverSession s = new SolverSession(p, UpdrConfig.defaults()))
        {
            assertNull(Logic.checkBounded(s, p.getSafety(), 3));
        }
    }

    @Test
    public void testCardinalityConstraint()
    {
        Program p = Protocols.lock();
        Sort node = p.getSort("node");
        SortedVar x = new SortedVar("X", node);
        SortedVar y = new SortedVar("Y", node);
        Expr allEqual = forall(Arrays.asList(x, y), eq(id("X"), id("Y")));
        try (SolverSession s = new SolverSession(p, UpdrConfig.defaults()))
        {
            assertNull(Logic.checkImplication(s, Collections.singletonList(Logic.cardinalityConstraint(node, 1)),
                    Collections.singletonList(allEqual)));
            Trace two = Logic.checkImplication(s,
                    Collections.singletonList(Logic.cardinalityConstraint(node, 2)),
                    Collections.singletonList(allEqual));
            assertNotNull(two);
            assertEquals(2, two.getUniverse(node).size());
        }
    }
}

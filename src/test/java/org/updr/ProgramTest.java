/*++
 Copyright (c) 2012 Microsoft Corporation

Module Name:

    ProgramTest.java

Abstract:

    Declaration checks performed when a program is built.

--*/

package org.updr;

import static org.junit.Assert.*;
import static org.updr.Exprs.*;

import java.util.Collections;

import org.junit.Test;

public class ProgramTest
{
    private static Program.Builder base()
    {
        Program.Builder b = Program.builder();
        Sort node = b.declareSort("node");
        b.declareRelation("holds", true, node);
        b.declareRelation("edge", false, node, node);
        b.declareConstant("root", false, node);
        return b;
    }

    private static void assertRejected(Program.Builder b, String fragment)
    {
        try
        {
            b.build();
            fail("expected a ProgramException mentioning '" + fragment + "'");
        }
        catch (ProgramException e)
        {
            assertTrue(e.getMessage(), e.getMessage().contains(fragment));
        }
    }

    @Test
    public void testLockProgramShape()
    {
        Program p = Protocols.lock();
        assertEquals(1, p.getSorts().size());
        assertEquals(3, p.getRelations().size());
        assertEquals(1, p.getDerivedRelations().size());
        assertEquals("locked", p.getDerivedRelations().get(0).getName());
        assertEquals(2, p.getInits().size());
        assertEquals(2, p.getTransitions().size());
        assertEquals(1, p.getSafeties().size());
        assertTrue(p.getTransition("acquire").modifies(p.getSymbol("holds")));
        assertNull(p.getTransition("missing"));
    }

    @Test
    public void testUnknownSymbol()
    {
        Program.Builder b = base();
        b.addInit(app("owner", id("root")));
        assertRejected(b, "unknown symbol owner");
    }

    @Test
    public void testArity()
    {
        Program.Builder b = base();
        b.addInit(app("edge", id("root")));
        assertRejected(b, "expects 2 arguments");
    }

    @Test
    public void testTermWhereFormulaExpected()
    {
        Program.Builder b = base();
        b.addInit(id("root"));
        assertRejected(b, "expected a formula");
    }

    @Test
    public void testOldOutsideTransition()
    {
        Program.Builder b = base();
        b.addInit(old(app("holds", id("root"))));
        assertRejected(b, "old() is only allowed in transitions");
    }

    @Test
    public void testNestedOld()
    {
        Program.Builder b = base();
        b.addTransition("t", Collections.<SortedVar>emptyList(), old(old(app("holds", id("root")))), "holds");
        assertRejected(b, "nested old()");
    }

    @Test
    public void testAxiomMayNotMentionMutableSymbols()
    {
        Program.Builder b = base();
        b.addAxiom(app("holds", id("root")));
        assertRejected(b, "mutable symbol holds is not allowed");
    }

    @Test
    public void testModifiesImmutable()
    {
        Program.Builder b = base();
        b.addTransition("t", Collections.<SortedVar>emptyList(), TRUE, "edge");
        assertRejected(b, "modifies immutable symbol edge");
    }

    @Test
    public void testModifiesUnknown()
    {
        Program.Builder b = base();
        b.addTransition("t", Collections.<SortedVar>emptyList(), TRUE, "nothing");
        assertRejected(b, "modifies unknown symbol nothing");
    }

    @Test
    public void testVariableShadowingSymbol()
    {
        Program.Builder b = base();
        Sort node = b.declareSort("other");
        b.addSafety(forall(new SortedVar("root", node), TRUE));
        assertRejected(b, "shadows a declared symbol");
    }

    @Test(expected = ProgramException.class)
    public void testDuplicateSymbol()
    {
        Program.Builder b = base();
        b.declareRelation("holds", false);
    }

    @Test
    public void testInvalidNames()
    {
        Program.Builder b = base();
        String[] bad = { "p!new", "1p", "", "a b", "p'" };
        for (String name : bad)
        {
            try
            {
                b.declareRelation(name, true);
                fail("accepted relation name '" + name + "'");
            }
            catch (ProgramException e)
            {
                assertTrue(e.getMessage(), e.getMessage().contains("invalid symbol name"));
            }
        }
        try
        {
            b.declareSort("node!0");
            fail("accepted sort name with '!'");
        }
        catch (ProgramException e)
        {
            assertTrue(e.getMessage(), e.getMessage().contains("invalid sort name"));
        }
        b.declareRelation("_p1", true);
    }

    @Test(expected = ProgramException.class)
    public void testFunctionWithoutArguments()
    {
        Program.Builder b = base();
        b.declareFunction("f", false, b.declareSort("s"));
    }

    @Test
    public void testInitIsSplitIntoConjuncts()
    {
        Program.Builder b = base();
        b.addInit(and(app("holds", id("root")), app("edge", id("root"), id("root"))));
        assertEquals(2, b.build().getInits().size());
    }

    @Test
    public void testFingerprint()
    {
        assertEquals(Protocols.lock().fingerprint(), Protocols.lock().fingerprint());
        assertNotEquals(Protocols.lock().fingerprint(), Protocols.unguardedLock().fingerprint());
        assertEquals(64, Protocols.lock().fingerprint().length());
    }

    @Test
    public void testToStringListsDeclarations()
    {
        String s = Protocols.lock().toString();
        assertTrue(s, s.contains("sort node"));
        assertTrue(s, s.contains("acquire"));
        assertTrue(s, s.contains("mutex"));
    }
}

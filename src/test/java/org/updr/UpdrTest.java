/*++
 Copyright (c) 2012 Microsoft Corporation

Module Name:

    UpdrTest.java

Abstract:

    The driver: verdicts, checkpoint files, counterexample JSON and the
    check of declared invariants.

--*/

package org.updr;

import static org.junit.Assert.*;
import static org.updr.Exprs.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.function.Predicate;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.updr.enumerations.CounterexampleKind;
import org.updr.enumerations.ResultKind;

public class UpdrTest
{
    @Rule
    public TemporaryFolder m_folder = new TemporaryFolder();

    private static JSONObject readJson(Path p) throws Exception
    {
        return new JSONObject(new String(Files.readAllBytes(p), StandardCharsets.UTF_8));
    }

    @Test
    public void testProved()
    {
        Program p = Protocols.lock();
        SearchResult r = Updr.run(p, UpdrConfig.defaults());
        assertEquals(ResultKind.PROVED, r.getKind());
        assertNull(r.getCounterexample());
        assertTrue(r.getInvariant().size() >= 2);
        assertTrue(r.toString(), r.toString().startsWith("proved at frame "));
    }

    @Test
    public void testDisprovedWritesCounterexample() throws Exception
    {
        Path json = m_folder.getRoot().toPath().resolve("cex.json");
        Path ckpt = m_folder.getRoot().toPath().resolve("state.ckpt");
        UpdrConfig config = UpdrConfig.builder().counterexampleJson(json).checkpointOut(ckpt).build();
        SearchResult r = Updr.run(Protocols.unguardedLock(), config);
        assertEquals(ResultKind.DISPROVED, r.getKind());
        assertEquals(CounterexampleKind.TRACE, r.getCounterexample().getKind());
        assertTrue(Files.exists(ckpt));

        JSONObject o = readJson(json);
        assertEquals("trace", o.getString("type"));
        assertFalse(o.getBoolean("abstract"));
        int length = r.getCounterexample().getLength();
        assertEquals(length + 1, o.getJSONArray("mutable").length());
        assertEquals(length, o.getJSONArray("transitions").length());
        assertEquals("acquire", o.getJSONArray("transitions").getString(0));
        JSONArray universes = o.getJSONArray("universes");
        assertEquals(1, universes.length());
        assertEquals("node", universes.getJSONObject(0).getString("sort"));
        assertTrue(universes.getJSONObject(0).getJSONArray("elements").length() >= 2);
    }

    @Test
    public void testInitialStateViolation() throws Exception
    {
        Path json = m_folder.getRoot().toPath().resolve("init.json");
        SearchResult r = Updr.run(Protocols.brokenInit(), UpdrConfig.builder().counterexampleJson(json).build());
        assertEquals(ResultKind.DISPROVED, r.getKind());
        Counterexample cex = r.getCounterexample();
        assertEquals(CounterexampleKind.INIT, cex.getKind());
        assertEquals(0, cex.getLength());
        assertTrue(cex.getTransitions().isEmpty());
        assertEquals("init", readJson(json).getString("type"));
    }

    @Test
    public void testResumeFromCheckpointFile()
    {
        Program p = Protocols.lock();
        Path ckpt = m_folder.getRoot().toPath().resolve("lock.ckpt");
        SearchResult first = Updr.run(p, UpdrConfig.builder().maxIterations(4).checkpointOut(ckpt).build());
        assertEquals(ResultKind.INTERRUPTED, first.getKind());
        assertTrue(Files.exists(ckpt));
        SearchResult second = Updr.run(p, UpdrConfig.builder().checkpointIn(ckpt).build());
        assertEquals(ResultKind.PROVED, second.getKind());
    }

    @Test(expected = CheckpointException.class)
    public void testCheckpointOfAnotherProgram()
    {
        Path ckpt = m_folder.getRoot().toPath().resolve("lock.ckpt");
        Updr.run(Protocols.lock(), UpdrConfig.builder().maxIterations(2).checkpointOut(ckpt).build());
        Updr.run(Protocols.token(), UpdrConfig.builder().checkpointIn(ckpt).build());
    }

    @Test
    public void testInconclusiveQueryIsCheckpointed()
    {
        Program p = Protocols.lock();
        Path ckpt = m_folder.getRoot().toPath().resolve("stuck.ckpt");
        UpdrConfig config = UpdrConfig.builder().timeoutMs(20).queryRetries(1).checkpointOut(ckpt).build();
        try (SolverSession session = new SolverSession(p, config))
        {
            session.setUndecided(new Predicate<String>()
            {
                @Override
                public boolean test(String description)
                {
                    return description.startsWith("predecessor in frame");
                }
            });
            try
            {
                SearchResult r = Updr.run(session);
                fail("undecided predecessor query gave " + r);
            }
            catch (InconclusiveQueryException e)
            {
                assertTrue(e.getQuery(), e.getQuery().startsWith("predecessor in frame"));
            }
        }
        assertTrue(Files.exists(ckpt));
        SearchState restored = Checkpoint.loadFrom(ckpt, p);
        assertTrue(restored.getNumFrames() >= 2);

        SearchResult resumed = Updr.run(p, UpdrConfig.builder().checkpointIn(ckpt).build());
        assertEquals(ResultKind.PROVED, resumed.getKind());
    }

    @Test
    public void testVerifyInitialViolation()
    {
        SearchResult r = Updr.verify(Protocols.brokenInit(), UpdrConfig.defaults());
        assertEquals(ResultKind.DISPROVED, r.getKind());
        Counterexample cex = r.getCounterexample();
        assertEquals(CounterexampleKind.INIT, cex.getKind());
        assertEquals(0, cex.getLength());
        assertEquals(1, cex.getTrace().getNumStates());
    }

    @Test
    public void testVerifyInductiveInvariants()
    {
        SearchResult r = Updr.verify(Protocols.lockWithInvariant(true), UpdrConfig.defaults());
        assertEquals(ResultKind.PROVED, r.getKind());
        assertEquals(2, r.getInvariant().size());
        assertEquals(-1, r.getFrame());
    }

    @Test
    public void testVerifyReportsCti()
    {
        SearchResult r = Updr.verify(Protocols.lockWithInvariant(false), UpdrConfig.defaults());
        assertEquals(ResultKind.DISPROVED, r.getKind());
        Counterexample cex = r.getCounterexample();
        assertEquals(CounterexampleKind.CTI, cex.getKind());
        assertEquals(1, cex.getLength());
        assertEquals(2, cex.getTrace().getNumStates());
    }

    /**
     * A one-step violation whose immutable symbol is named like the
     * post-state copy of the mutable one.
     **/
    private static Program flip(String immutableName)
    {
        Program.Builder b = Program.builder();
        b.declareRelation("p", true);
        b.declareRelation(immutableName, false);
        b.addInit(and(not(id("p")), not(id(immutableName))));
        b.addTransition("flip", Collections.<SortedVar>emptyList(), id("p"), "p");
        b.addSafety(not(id("p")));
        return b.build();
    }

    @Test
    public void testImmutableNamedLikeStateCopy()
    {
        for (String name : new String[] { "q", "new_p", "p_new", "old_p", "state1_p" })
        {
            SearchResult r = Updr.run(flip(name), UpdrConfig.defaults());
            assertEquals(name, ResultKind.DISPROVED, r.getKind());
            assertEquals(name, 1, r.getCounterexample().getLength());
        }
    }

    @Test
    public void testConstantNamedLikeAnElement()
    {
        for (String name : new String[] { "c", "NODE0", "NODE1" })
        {
            SearchResult r = Updr.run(Protocols.unguardedLock(name), UpdrConfig.builder().maxIterations(200).build());
            assertEquals(name, ResultKind.DISPROVED, r.getKind());
            assertFalse(name, r.getCounterexample().isAbstract());
        }
    }

    @Test
    public void testKeyPrefix()
    {
        SearchResult r = Updr.run(Protocols.token(), UpdrConfig.builder().keyPrefix("p1_").seed(11).build());
        assertEquals(ResultKind.PROVED, r.getKind());
    }
}

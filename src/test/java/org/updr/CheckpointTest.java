/*++
 Copyright (c) 2012 Microsoft Corporation

Module Name:

    CheckpointTest.java

Abstract:

    Saving and restoring search states, and rejection of checkpoints that
    do not belong to the program.

--*/

package org.updr;

import static org.junit.Assert.*;
import static org.updr.Exprs.*;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.updr.enumerations.ResultKind;

public class CheckpointTest
{
    @Rule
    public TemporaryFolder m_folder = new TemporaryFolder();

    private final Program m_program = Protocols.lock();

    private SearchState interruptedAfter(int iterations)
    {
        SearchState state = SearchState.initial(m_program);
        try (SolverSession s = new SolverSession(m_program, UpdrConfig.builder().maxIterations(iterations).build()))
        {
            assertEquals(ResultKind.INTERRUPTED, new Frames(s, state).search().getKind());
        }
        return state;
    }

    private SearchResult resume(SearchState state)
    {
        try (SolverSession s = new SolverSession(m_program, UpdrConfig.defaults()))
        {
            return new Frames(s, state).search();
        }
    }

    private static void assertSameState(SearchState expected, SearchState actual)
    {
        assertEquals(expected.getNumFrames(), actual.getNumFrames());
        for (int i = 0; i < expected.getNumFrames(); i++)
            assertEquals(expected.getFrame(i).getPredicates(), actual.getFrame(i).getPredicates());
        assertEquals(expected.getPredicates(), actual.getPredicates());
        assertEquals(expected.getStateCount(), actual.getStateCount());
        assertEquals(expected.getIterations(), actual.getIterations());
        assertEquals(expected.getSafeUpTo(), actual.getSafeUpTo());
        assertEquals(expected.getObligations().size(), actual.getObligations().size());
    }

    @Test
    public void testRoundTrip()
    {
        SearchState state = interruptedAfter(3);
        SearchState restored = Checkpoint.load(Checkpoint.save(state, m_program), m_program);
        assertSameState(state, restored);
        assertEquals(ResultKind.PROVED, resume(restored).getKind());
    }

    @Test
    public void testPendingObligationSurvives()
    {
        SearchState state = interruptedAfter(1);
        assertEquals(1, state.getObligations().size());
        SearchState restored = Checkpoint.load(Checkpoint.save(state, m_program), m_program);
        assertSameState(state, restored);
        Obligation expected = state.getObligations().peek();
        Obligation actual = restored.getObligations().peek();
        assertEquals(expected.getFrame(), actual.getFrame());
        assertEquals(expected.isSafetyGoal(), actual.isSafetyGoal());
        assertEquals(expected.getDiagram().toExpr(), actual.getDiagram().toExpr());
        assertEquals(ResultKind.PROVED, resume(restored).getKind());
    }

    @Test
    public void testSameVerdictAsUninterruptedRun()
    {
        SearchResult direct = resume(SearchState.initial(m_program));
        SearchState restored = Checkpoint.load(Checkpoint.save(interruptedAfter(5), m_program), m_program);
        assertEquals(direct.getKind(), resume(restored).getKind());
    }

    @Test
    public void testFiles() throws Exception
    {
        File f = m_folder.newFile("lock.ckpt");
        SearchState state = interruptedAfter(3);
        Checkpoint.saveTo(f.toPath(), state, m_program);
        assertSameState(state, Checkpoint.loadFrom(f.toPath(), m_program));
    }

    @Test(expected = CheckpointException.class)
    public void testMissingFile()
    {
        Checkpoint.loadFrom(new File(m_folder.getRoot(), "missing.ckpt").toPath(), m_program);
    }

    @Test(expected = CheckpointException.class)
    public void testGarbage()
    {
        Checkpoint.load("not json at all".getBytes(StandardCharsets.UTF_8), m_program);
    }

    private JSONObject saved()
    {
        return new JSONObject(new String(Checkpoint.save(interruptedAfter(3), m_program), StandardCharsets.UTF_8));
    }

    private void assertRejected(JSONObject o, String fragment)
    {
        try
        {
            Checkpoint.load(o.toString().getBytes(StandardCharsets.UTF_8), m_program);
            fail("expected a CheckpointException mentioning '" + fragment + "'");
        }
        catch (CheckpointException e)
        {
            assertTrue(e.getMessage(), e.getMessage().contains(fragment));
        }
    }

    @Test
    public void testWrongFormat()
    {
        JSONObject o = saved();
        o.put("format", "something-else");
        assertRejected(o, "not a checkpoint");
    }

    @Test
    public void testWrongVersion()
    {
        JSONObject o = saved();
        o.put("version", 99);
        assertRejected(o, "unsupported checkpoint version 99");
    }

    @Test
    public void testOtherProgram()
    {
        byte[] bytes = Checkpoint.save(interruptedAfter(3), m_program);
        try
        {
            Checkpoint.load(bytes, Protocols.unguardedLock());
            fail("loaded a checkpoint of another program");
        }
        catch (CheckpointException e)
        {
            assertTrue(e.getMessage(), e.getMessage().contains("another program"));
        }
    }

    @Test
    public void testUnknownSymbolInFrame()
    {
        JSONObject o = saved();
        o.getJSONArray("frames").getJSONArray(1).put(ExprJson.encode(app("nothing", id("X"))));
        assertRejected(o, "does not match the program");
    }

    @Test
    public void testMissingField()
    {
        JSONObject o = saved();
        o.remove("frames");
        assertRejected(o, "malformed checkpoint");
    }

    @Test
    public void testTooFewFrames()
    {
        JSONObject o = saved();
        o.put("frames", new JSONArray().put(new JSONArray()));
        assertRejected(o, "frames");
    }
}

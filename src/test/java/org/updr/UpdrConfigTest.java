/*++
 Copyright (c) 2012 Microsoft Corporation

Module Name:

    UpdrConfigTest.java

Abstract:

    Defaults and parsing of the updr.* configuration keys.

--*/

package org.updr;

import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Properties;

import org.junit.Test;
import org.updr.enumerations.GeneralizationStrategy;
import org.updr.enumerations.PushFrameZero;
import org.updr.enumerations.TransitionOrder;

public class UpdrConfigTest
{
    @Test
    public void testDefaults()
    {
        UpdrConfig c = UpdrConfig.defaults();
        assertEquals(0, c.getSeed());
        assertEquals(0, c.getTimeoutMs());
        assertEquals(2, c.getQueryRetries());
        assertEquals(2.0, c.getQueryBackoff(), 0.0);
        assertTrue(c.isMinimizeModels());
        assertTrue(c.isSimplifyDiagram());
        assertEquals(GeneralizationStrategy.UNSAT_CORE, c.getGeneralization());
        assertFalse(c.isSmokeTest());
        assertFalse(c.isBlockMayCexs());
        assertEquals(PushFrameZero.ALWAYS, c.getPushFrameZero());
        assertEquals(TransitionOrder.DECLARED, c.getTransitionOrder());
        assertEquals(0, c.getMaxIterations());
        assertTrue(c.isRecheckInvariant());
        assertTrue(c.isConcretizeCounterexamples());
        assertEquals("", c.getKeyPrefix());
        assertNull(c.getCheckpointIn());
        assertNull(c.getCounterexampleJson());
    }

    @Test
    public void testFromProperties()
    {
        Properties p = new Properties();
        p.setProperty(UpdrConfig.SEED, "7");
        p.setProperty(UpdrConfig.TIMEOUT_MS, " 1500 ");
        p.setProperty(UpdrConfig.GENERALIZATION, "brute-force");
        p.setProperty(UpdrConfig.PUSH_FRAME_ZERO, "never");
        p.setProperty(UpdrConfig.TRANSITION_ORDER, "Fastest-First");
        p.setProperty(UpdrConfig.BLOCK_MAY_CEXS, "TRUE");
        p.setProperty(UpdrConfig.MAX_ITERATIONS, "100");
        p.setProperty(UpdrConfig.KEY_PREFIX, "run1_");
        p.setProperty(UpdrConfig.CHECKPOINT_OUT, "/tmp/updr.ckpt");
        p.setProperty(UpdrConfig.SMOKE_TEST, "");
        UpdrConfig c = UpdrConfig.fromProperties(p);
        assertEquals(7, c.getSeed());
        assertEquals(1500, c.getTimeoutMs());
        assertEquals(GeneralizationStrategy.BRUTE_FORCE, c.getGeneralization());
        assertEquals(PushFrameZero.NEVER, c.getPushFrameZero());
        assertEquals(TransitionOrder.FASTEST_FIRST, c.getTransitionOrder());
        assertTrue(c.isBlockMayCexs());
        assertEquals(100, c.getMaxIterations());
        assertEquals("run1_", c.getKeyPrefix());
        assertEquals(Paths.get("/tmp/updr.ckpt"), c.getCheckpointOut());
        assertFalse(c.isSmokeTest());
    }

    @Test
    public void testToBuilderKeepsValues()
    {
        UpdrConfig c = UpdrConfig.builder().seed(3).maxIterations(9).smokeTest(true).build();
        UpdrConfig d = c.toBuilder().maxIterations(0).build();
        assertEquals(3, d.getSeed());
        assertTrue(d.isSmokeTest());
        assertEquals(0, d.getMaxIterations());
        assertEquals(9, c.getMaxIterations());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadInteger()
    {
        Properties p = new Properties();
        p.setProperty(UpdrConfig.SEED, "seven");
        UpdrConfig.fromProperties(p);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadBoolean()
    {
        Properties p = new Properties();
        p.setProperty(UpdrConfig.MINIMIZE_MODELS, "yes");
        UpdrConfig.fromProperties(p);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadEnum()
    {
        Properties p = new Properties();
        p.setProperty(UpdrConfig.GENERALIZATION, "magic");
        UpdrConfig.fromProperties(p);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBackoffBelowOne()
    {
        UpdrConfig.builder().queryBackoff(0.5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeTimeout()
    {
        Properties p = new Properties();
        p.setProperty(UpdrConfig.TIMEOUT_MS, "-1");
        UpdrConfig.fromProperties(p);
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    BlockingContext.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.Collections;
import java.util.Set;

/**
 * The question a generalization must keep answering with yes: is the
 * diagram disjoint from frame 0 and without predecessors in the frame
 * before {@link #getFrame()}?
 **/
public final class BlockingContext
{
    private final Frames m_frames;
    private final int m_frame;
    private final Set<Integer> m_core;

    BlockingContext(Frames frames, int frame, Set<Integer> core)
    {
        m_frames = frames;
        m_frame = frame;
        m_core = core;
    }

    /**
     * The frame the diagram is blocked at.
     **/
    public int getFrame()
    {
        return m_frame;
    }

    /**
     * Indices of the literals whose trackers appeared in the unsat cores of
     * the refuted predecessor and initial-state queries; null if unknown.
     **/
    public Set<Integer> getCore()
    {
        return m_core == null ? null : Collections.unmodifiableSet(m_core);
    }

    public boolean isBlocked(Diagram d)
    {
        return !m_frames.intersectsInit(d) && !m_frames.hasPredecessor(d, m_frame - 1);
    }
}

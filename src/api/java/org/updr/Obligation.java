/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Obligation.java

Abstract:

Notes:
    
**/ 

package org.updr;

import com.google.common.base.Preconditions;

/**
 * A state, given by its diagram, that must be shown unreachable within
 * {@link #getFrame()} steps. Must-obligations lead to a safety violation;
 * may-obligations come from failed pushes and only block the push.
 **/
public final class Obligation
{
    private final Diagram m_diagram;
    private final int m_frame;
    private final String m_transition;
    private final boolean m_safetyGoal;
    private final boolean m_may;

    Obligation(Diagram diagram, int frame, String transition, boolean safetyGoal, boolean may)
    {
        Preconditions.checkArgument(frame >= 0, "negative frame");
        m_diagram = Preconditions.checkNotNull(diagram);
        m_frame = frame;
        m_transition = transition;
        m_safetyGoal = safetyGoal;
        m_may = may;
    }

    public Diagram getDiagram()
    {
        return m_diagram;
    }

    public int getFrame()
    {
        return m_frame;
    }

    /**
     * The transition leading from this state to the state of the obligation
     * below it on the stack; null for the bottom obligation.
     **/
    public String getTransition()
    {
        return m_transition;
    }

    /**
     * Whether the state violates safety, i.e. it opened the chain.
     **/
    public boolean isSafetyGoal()
    {
        return m_safetyGoal;
    }

    public boolean isMay()
    {
        return m_may;
    }

    @Override
    public String toString()
    {
        return "[" + m_frame + (m_may ? ", may" : "") + (m_transition != null ? ", via " + m_transition : "") + "] "
                + m_diagram;
    }
}

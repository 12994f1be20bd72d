/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Counterexample.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.updr.enumerations.CounterexampleKind;

/**
 * Evidence that a property fails. Concrete counterexamples carry a
 * {@link Trace}; abstract ones only the chain of diagrams from a state
 * intersecting the initial states to a safety violation.
 **/
public final class Counterexample
{
    private final CounterexampleKind m_kind;
    private final Trace m_trace;
    private final ImmutableList<Expr> m_diagrams;
    private final ImmutableList<String> m_transitions;

    private Counterexample(CounterexampleKind kind, Trace trace, List<Expr> diagrams, List<String> transitions)
    {
        m_kind = kind;
        m_trace = trace;
        m_diagrams = ImmutableList.copyOf(diagrams);
        m_transitions = ImmutableList.copyOf(transitions);
    }

    /**
     * A concrete counterexample; its transitions are the trace's.
     **/
    public static Counterexample concrete(CounterexampleKind kind, Trace trace, List<Expr> diagrams)
    {
        Preconditions.checkNotNull(trace);
        List<String> transitions = Collections.<String>emptyList();
        if (!trace.getTransitions().contains(null))
            transitions = trace.getTransitions();
        return new Counterexample(kind, trace, diagrams, transitions);
    }

    /**
     * An abstract trace: {@code diagrams.size() - 1} steps between diagrams.
     **/
    public static Counterexample abstractTrace(List<Expr> diagrams, List<String> transitions)
    {
        Preconditions.checkArgument(transitions.size() == diagrams.size() - 1, "one transition per step");
        return new Counterexample(CounterexampleKind.TRACE, null, diagrams, transitions);
    }

    public CounterexampleKind getKind()
    {
        return m_kind;
    }

    public boolean isAbstract()
    {
        return m_trace == null;
    }

    /**
     * The concrete trace, or null for abstract counterexamples.
     **/
    public Trace getTrace()
    {
        return m_trace;
    }

    /**
     * The diagrams of the obligation chain, first state first; empty when the
     * counterexample did not come from a chain.
     **/
    public ImmutableList<Expr> getDiagrams()
    {
        return m_diagrams;
    }

    public ImmutableList<String> getTransitions()
    {
        return m_transitions;
    }

    /**
     * The number of steps.
     **/
    public int getLength()
    {
        if (m_trace != null)
            return m_trace.getNumStates() - 1;
        return m_diagrams.size() - 1;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        sb.append(isAbstract() ? "abstract " : "").append(m_kind.getName()).append(" counterexample of length ")
                .append(getLength()).append('\n');
        if (m_trace != null)
            sb.append(m_trace);
        else
        {
            for (int i = 0; i < m_diagrams.size(); i++)
            {
                if (i > 0)
                    sb.append("transition ").append(m_transitions.get(i - 1)).append('\n');
                sb.append("state ").append(i).append(": ").append(m_diagrams.get(i)).append('\n');
            }
        }
        return sb.toString();
    }
}

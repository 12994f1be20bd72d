/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    SearchResult.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.updr.enumerations.ResultKind;

/**
 * The outcome of a search: an inductive invariant, a counterexample, or an
 * interruption.
 **/
public final class SearchResult
{
    private final ResultKind m_kind;
    private final ImmutableList<Expr> m_invariant;
    private final int m_frame;
    private final Counterexample m_counterexample;

    private SearchResult(ResultKind kind, List<Expr> invariant, int frame, Counterexample counterexample)
    {
        m_kind = kind;
        m_invariant = ImmutableList.copyOf(invariant);
        m_frame = frame;
        m_counterexample = counterexample;
    }

    /**
     * The safety property holds; {@code invariant} is an inductive
     * strengthening, found at frame {@code frame}.
     **/
    public static SearchResult proved(List<Expr> invariant, int frame)
    {
        return new SearchResult(ResultKind.PROVED, invariant, frame, null);
    }

    public static SearchResult disproved(Counterexample counterexample)
    {
        return new SearchResult(ResultKind.DISPROVED, ImmutableList.<Expr>of(), -1,
                Preconditions.checkNotNull(counterexample));
    }

    public static SearchResult interrupted()
    {
        return new SearchResult(ResultKind.INTERRUPTED, ImmutableList.<Expr>of(), -1, null);
    }

    public ResultKind getKind()
    {
        return m_kind;
    }

    /**
     * The conjuncts of the inductive invariant; empty unless proved.
     **/
    public ImmutableList<Expr> getInvariant()
    {
        return m_invariant;
    }

    /**
     * The index of the frame that reached the fixpoint; -1 unless proved.
     **/
    public int getFrame()
    {
        return m_frame;
    }

    /**
     * The counterexample; null unless disproved.
     **/
    public Counterexample getCounterexample()
    {
        return m_counterexample;
    }

    @Override
    public String toString()
    {
        switch (m_kind)
        {
        case PROVED:
            return "proved at frame " + m_frame + ":\n  " + Joiner.on("\n  ").join(m_invariant);
        case DISPROVED:
            return "disproved: " + m_counterexample;
        default:
            return "interrupted";
        }
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    SearchState.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;

/**
 * Everything the search needs to resume: frames, the log of learned
 * predicates, counters, the highest frame known to imply safety, the push
 * cache and pending must-obligations.
 **/
public final class SearchState
{
    private final List<Frame> m_frames = new ArrayList<Frame>();
    private final Set<Expr> m_predicates = new LinkedHashSet<Expr>();
    private final List<Map<Expr, Integer>> m_pushCache = new ArrayList<Map<Expr, Integer>>();
    private final Deque<Obligation> m_obligations = new ArrayDeque<Obligation>();
    private int m_stateCount;
    private int m_iterations;
    private int m_safeUpTo = -1;

    SearchState()
    {
    }

    /**
     * The starting state: frame 0 holds the initial conditions, frame 1 is
     * empty.
     **/
    public static SearchState initial(Program program)
    {
        SearchState s = new SearchState();
        Frame f0 = s.addFrame();
        for (Expr init : program.getInits())
            f0.add(init);
        s.addFrame();
        return s;
    }

    Frame addFrame()
    {
        Frame f = new Frame(m_frames.size());
        m_frames.add(f);
        m_pushCache.add(new HashMap<Expr, Integer>());
        return f;
    }

    public List<Frame> getFrames()
    {
        return Collections.unmodifiableList(m_frames);
    }

    public Frame getFrame(int i)
    {
        return m_frames.get(i);
    }

    public int getNumFrames()
    {
        return m_frames.size();
    }

    /**
     * The distinct learned predicates, in order of discovery.
     **/
    public List<Expr> getPredicates()
    {
        return Collections.unmodifiableList(new ArrayList<Expr>(m_predicates));
    }

    /**
     * The number of blocked states, counting states whose predicate was
     * learned before.
     **/
    public int getStateCount()
    {
        return m_stateCount;
    }

    public int getIterations()
    {
        return m_iterations;
    }

    /**
     * The highest frame index known to imply safety; -1 if none.
     **/
    public int getSafeUpTo()
    {
        return m_safeUpTo;
    }

    /**
     * For each frame, the size it had when a predicate last failed to be
     * pushed from it.
     **/
    Map<Expr, Integer> getPushCache(int frame)
    {
        return m_pushCache.get(frame);
    }

    /**
     * Pending must-obligations, top of the stack first.
     **/
    Deque<Obligation> getObligations()
    {
        return m_obligations;
    }

    void recordPredicate(Expr predicate)
    {
        m_stateCount++;
        m_predicates.add(predicate);
    }

    void restoreCounters(int stateCount, int iterations, int safeUpTo)
    {
        Preconditions.checkArgument(stateCount >= 0 && iterations >= 0, "negative counter");
        Preconditions.checkArgument(safeUpTo >= -1 && safeUpTo < m_frames.size(), "safe frame out of range");
        m_stateCount = stateCount;
        m_iterations = iterations;
        m_safeUpTo = safeUpTo;
    }

    void restorePredicate(Expr predicate)
    {
        m_predicates.add(predicate);
    }

    void incrementIterations()
    {
        m_iterations++;
    }

    void setSafeUpTo(int frame)
    {
        Preconditions.checkArgument(frame >= m_safeUpTo && frame < m_frames.size(), "safe frame out of range");
        m_safeUpTo = frame;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        for (Frame f : m_frames)
            sb.append(f).append('\n');
        sb.append(m_predicates.size()).append(" predicates, ").append(m_stateCount).append(" states, ")
                .append(m_iterations).append(" iterations, safe up to ").append(m_safeUpTo);
        return sb.toString();
    }
}

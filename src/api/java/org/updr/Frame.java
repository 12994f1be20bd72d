/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Frame.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.LinkedHashSet;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * An over-approximation of the states reachable within {@link #getIndex()}
 * steps, as a set of predicates. Predicates are only ever added.
 **/
public final class Frame
{
    private final int m_index;
    private final Set<Expr> m_predicates = new LinkedHashSet<Expr>();

    Frame(int index)
    {
        m_index = index;
    }

    public int getIndex()
    {
        return m_index;
    }

    /**
     * The predicates, in insertion order.
     **/
    public ImmutableList<Expr> getPredicates()
    {
        return ImmutableList.copyOf(m_predicates);
    }

    public boolean contains(Expr predicate)
    {
        return m_predicates.contains(predicate);
    }

    public boolean containsAll(Frame other)
    {
        return m_predicates.containsAll(other.m_predicates);
    }

    public int size()
    {
        return m_predicates.size();
    }

    boolean add(Expr predicate)
    {
        return m_predicates.add(predicate);
    }

    @Override
    public String toString()
    {
        return "frame " + m_index + ":\n  " + Joiner.on("\n  ").join(m_predicates);
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    TransitionDecl.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A transition: existentially quantified parameters, the mutable symbols it
 * may change, and a two-state body in which {@code old(e)} refers to the
 * pre-state.
 **/
public final class TransitionDecl
{
    private final String m_name;
    private final ImmutableList<SortedVar> m_params;
    private final ImmutableList<String> m_mods;
    private final Expr m_body;

    TransitionDecl(String name, List<SortedVar> params, List<String> mods, Expr body)
    {
        m_name = Preconditions.checkNotNull(name);
        m_params = ImmutableList.copyOf(params);
        m_mods = ImmutableList.copyOf(mods);
        m_body = Preconditions.checkNotNull(body);
    }

    public String getName()
    {
        return m_name;
    }

    public ImmutableList<SortedVar> getParams()
    {
        return m_params;
    }

    /**
     * Names of the symbols the transition may modify.
     **/
    public ImmutableList<String> getMods()
    {
        return m_mods;
    }

    public boolean modifies(SymbolDecl d)
    {
        return m_mods.contains(d.getName());
    }

    public Expr getBody()
    {
        return m_body;
    }

    @Override
    public String toString()
    {
        return "transition " + m_name + "(" + Joiner.on(", ").join(m_params) + ")\n  modifies "
                + Joiner.on(", ").join(m_mods) + "\n  " + m_body;
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    SymbolDecl.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.updr.enumerations.SymbolKind;

/**
 * Base class of declared relations, constants and functions.
 **/
public abstract class SymbolDecl
{
    private final String m_name;
    private final boolean m_mutable;
    private final ImmutableList<Sort> m_domain;

    SymbolDecl(String name, boolean mutable, List<Sort> domain)
    {
        m_name = Preconditions.checkNotNull(name);
        m_mutable = mutable;
        m_domain = ImmutableList.copyOf(domain);
    }

    /**
     * The name of the symbol.
     **/
    public String getName()
    {
        return m_name;
    }

    /**
     * Whether the interpretation of the symbol may change from one state to
     * the next.
     **/
    public boolean isMutable()
    {
        return m_mutable;
    }

    /**
     * The argument sorts; empty for constants and nullary relations.
     **/
    public ImmutableList<Sort> getDomain()
    {
        return m_domain;
    }

    /**
     * The number of arguments.
     **/
    public int getArity()
    {
        return m_domain.size();
    }

    /**
     * The sort of an application of this symbol.
     **/
    public abstract Sort getRange();

    /**
     * The kind of the symbol.
     **/
    public abstract SymbolKind getKind();

    /**
     * Whether the interpretation is fixed by a defining axiom.
     **/
    public boolean isDerived()
    {
        return false;
    }

    @Override
    public String toString()
    {
        return m_name;
    }
}

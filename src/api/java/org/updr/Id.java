/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Id.java

Abstract:

Notes:
    
**/ 

package org.updr;

import com.google.common.base.Preconditions;

import org.updr.enumerations.ExprKind;

/**
 * A reference to a bound variable, a constant or a nullary relation.
 **/
public final class Id extends Expr
{
    private final String m_name;

    Id(String name)
    {
        m_name = Preconditions.checkNotNull(name);
    }

    public String getName()
    {
        return m_name;
    }

    @Override
    public ExprKind getKind()
    {
        return ExprKind.ID;
    }

    @Override
    int precedence()
    {
        return PREC_ATOM;
    }

    @Override
    void print(StringBuilder sb)
    {
        sb.append(m_name);
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof Id && ((Id) o).m_name.equals(m_name);
    }

    @Override
    public int hashCode()
    {
        return m_name.hashCode();
    }
}

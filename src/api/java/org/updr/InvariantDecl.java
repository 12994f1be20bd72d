/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    InvariantDecl.java

Abstract:

Notes:
    
**/ 

package org.updr;

import com.google.common.base.Preconditions;

/**
 * A declared invariant. Safety invariants make up the property the search
 * proves or refutes.
 **/
public final class InvariantDecl
{
    private final String m_name;
    private final Expr m_expr;
    private final boolean m_safety;

    InvariantDecl(String name, Expr expr, boolean safety)
    {
        m_name = name;
        m_expr = Preconditions.checkNotNull(expr);
        m_safety = safety;
    }

    /**
     * The name, or null for anonymous invariants.
     **/
    public String getName()
    {
        return m_name;
    }

    public Expr getExpr()
    {
        return m_expr;
    }

    public boolean isSafety()
    {
        return m_safety;
    }

    @Override
    public String toString()
    {
        return (m_safety ? "safety " : "invariant ") + (m_name != null ? "[" + m_name + "] " : "") + m_expr;
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    BoolLit.java

Abstract:

Notes:
    
**/ 

package org.updr;

import org.updr.enumerations.ExprKind;

/**
 * The literals {@code true} and {@code false}.
 **/
public final class BoolLit extends Expr
{
    private final boolean m_value;

    BoolLit(boolean value)
    {
        m_value = value;
    }

    public boolean getValue()
    {
        return m_value;
    }

    @Override
    public ExprKind getKind()
    {
        return ExprKind.BOOL_LITERAL;
    }

    @Override
    int precedence()
    {
        return PREC_ATOM;
    }

    @Override
    void print(StringBuilder sb)
    {
        sb.append(m_value ? "true" : "false");
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof BoolLit && ((BoolLit) o).m_value == m_value;
    }

    @Override
    public int hashCode()
    {
        return m_value ? 1231 : 1237;
    }
}

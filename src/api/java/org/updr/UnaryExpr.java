/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    UnaryExpr.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.Objects;

import com.google.common.base.Preconditions;

import org.updr.enumerations.ExprKind;

/**
 * Negation, and {@code old(e)}: the pre-state value of {@code e} in a
 * two-state formula.
 **/
public final class UnaryExpr extends Expr
{
    private final ExprKind m_kind;
    private final Expr m_arg;

    UnaryExpr(ExprKind kind, Expr arg)
    {
        Preconditions.checkArgument(kind == ExprKind.NOT || kind == ExprKind.OLD, "not a unary kind: %s", kind);
        m_kind = kind;
        m_arg = Preconditions.checkNotNull(arg);
    }

    public Expr getArg()
    {
        return m_arg;
    }

    @Override
    public ExprKind getKind()
    {
        return m_kind;
    }

    @Override
    int precedence()
    {
        return m_kind == ExprKind.NOT ? PREC_NOT : PREC_ATOM;
    }

    @Override
    void print(StringBuilder sb)
    {
        if (m_kind == ExprKind.NOT)
        {
            sb.append('!');
            printOperand(sb, m_arg, PREC_NOT);
        }
        else
        {
            sb.append("old(");
            m_arg.print(sb);
            sb.append(')');
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof UnaryExpr))
            return false;
        UnaryExpr other = (UnaryExpr) o;
        return m_kind == other.m_kind && m_arg.equals(other.m_arg);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(m_kind, m_arg);
    }
}

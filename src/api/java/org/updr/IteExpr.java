/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    IteExpr.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.Objects;

import com.google.common.base.Preconditions;

import org.updr.enumerations.ExprKind;

/**
 * If-then-else over formulas or terms.
 **/
public final class IteExpr extends Expr
{
    private final Expr m_cond;
    private final Expr m_then;
    private final Expr m_else;

    IteExpr(Expr cond, Expr thenBranch, Expr elseBranch)
    {
        m_cond = Preconditions.checkNotNull(cond);
        m_then = Preconditions.checkNotNull(thenBranch);
        m_else = Preconditions.checkNotNull(elseBranch);
    }

    public Expr getCond()
    {
        return m_cond;
    }

    public Expr getThen()
    {
        return m_then;
    }

    public Expr getElse()
    {
        return m_else;
    }

    @Override
    public ExprKind getKind()
    {
        return ExprKind.ITE;
    }

    @Override
    int precedence()
    {
        return PREC_QUANT;
    }

    @Override
    void print(StringBuilder sb)
    {
        sb.append("if ");
        printOperand(sb, m_cond, PREC_IFF);
        sb.append(" then ");
        printOperand(sb, m_then, PREC_IFF);
        sb.append(" else ");
        m_else.print(sb);
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof IteExpr))
            return false;
        IteExpr other = (IteExpr) o;
        return m_cond.equals(other.m_cond) && m_then.equals(other.m_then) && m_else.equals(other.m_else);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(m_cond, m_then, m_else);
    }
}

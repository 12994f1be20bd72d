/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    NaryExpr.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.updr.enumerations.ExprKind;

/**
 * Conjunction and disjunction of two or more operands.
 **/
public final class NaryExpr extends Expr
{
    private final ExprKind m_kind;
    private final ImmutableList<Expr> m_args;

    NaryExpr(ExprKind kind, List<Expr> args)
    {
        Preconditions.checkArgument(kind == ExprKind.AND || kind == ExprKind.OR, "not an n-ary kind: %s", kind);
        m_kind = kind;
        m_args = ImmutableList.copyOf(args);
    }

    public ImmutableList<Expr> getArgs()
    {
        return m_args;
    }

    @Override
    public ExprKind getKind()
    {
        return m_kind;
    }

    @Override
    int precedence()
    {
        return m_kind == ExprKind.AND ? PREC_AND : PREC_OR;
    }

    @Override
    void print(StringBuilder sb)
    {
        String op = m_kind == ExprKind.AND ? " & " : " | ";
        for (int i = 0; i < m_args.size(); i++)
        {
            if (i > 0)
                sb.append(op);
            printOperand(sb, m_args.get(i), precedence() + 1);
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof NaryExpr))
            return false;
        NaryExpr other = (NaryExpr) o;
        return m_kind == other.m_kind && m_args.equals(other.m_args);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(m_kind, m_args);
    }
}

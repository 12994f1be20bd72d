/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    AppExpr.java

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
 * Application of a relation or function to arguments.
 **/
public final class AppExpr extends Expr
{
    private final String m_callee;
    private final ImmutableList<Expr> m_args;

    AppExpr(String callee, List<Expr> args)
    {
        m_callee = Preconditions.checkNotNull(callee);
        m_args = ImmutableList.copyOf(args);
        Preconditions.checkArgument(!m_args.isEmpty(), "application of %s without arguments", callee);
    }

    public String getCallee()
    {
        return m_callee;
    }

    public ImmutableList<Expr> getArgs()
    {
        return m_args;
    }

    @Override
    public ExprKind getKind()
    {
        return ExprKind.APP;
    }

    @Override
    int precedence()
    {
        return PREC_ATOM;
    }

    @Override
    void print(StringBuilder sb)
    {
        sb.append(m_callee).append('(');
        for (int i = 0; i < m_args.size(); i++)
        {
            if (i > 0)
                sb.append(", ");
            m_args.get(i).print(sb);
        }
        sb.append(')');
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof AppExpr))
            return false;
        AppExpr other = (AppExpr) o;
        return m_callee.equals(other.m_callee) && m_args.equals(other.m_args);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(m_callee, m_args);
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    QuantifierExpr.java

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
 * Universal and existential quantification over sorted variables.
 **/
public final class QuantifierExpr extends Expr
{
    private final ExprKind m_kind;
    private final ImmutableList<SortedVar> m_vars;
    private final Expr m_body;

    QuantifierExpr(ExprKind kind, List<SortedVar> vars, Expr body)
    {
        Preconditions.checkArgument(kind.isQuantifier(), "not a quantifier kind: %s", kind);
        m_kind = kind;
        m_vars = ImmutableList.copyOf(vars);
        Preconditions.checkArgument(!m_vars.isEmpty(), "quantifier without variables");
        m_body = Preconditions.checkNotNull(body);
    }

    public ImmutableList<SortedVar> getVars()
    {
        return m_vars;
    }

    public Expr getBody()
    {
        return m_body;
    }

    public boolean isForall()
    {
        return m_kind == ExprKind.FORALL;
    }

    @Override
    public ExprKind getKind()
    {
        return m_kind;
    }

    @Override
    int precedence()
    {
        return PREC_QUANT;
    }

    @Override
    void print(StringBuilder sb)
    {
        sb.append(isForall() ? "forall " : "exists ");
        for (int i = 0; i < m_vars.size(); i++)
        {
            if (i > 0)
                sb.append(", ");
            sb.append(m_vars.get(i));
        }
        sb.append(". ");
        m_body.print(sb);
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof QuantifierExpr))
            return false;
        QuantifierExpr other = (QuantifierExpr) o;
        return m_kind == other.m_kind && m_vars.equals(other.m_vars) && m_body.equals(other.m_body);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(m_kind, m_vars, m_body);
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    BinaryExpr.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.Objects;

import com.google.common.base.Preconditions;

import org.updr.enumerations.ExprKind;

/**
 * Implication, bi-implication, equality and disequality.
 **/
public final class BinaryExpr extends Expr
{
    private final ExprKind m_kind;
    private final Expr m_left;
    private final Expr m_right;

    BinaryExpr(ExprKind kind, Expr left, Expr right)
    {
        Preconditions.checkArgument(kind == ExprKind.IMPLIES || kind == ExprKind.IFF || kind == ExprKind.EQ
                || kind == ExprKind.NEQ, "not a binary kind: %s", kind);
        m_kind = kind;
        m_left = Preconditions.checkNotNull(left);
        m_right = Preconditions.checkNotNull(right);
    }

    public Expr getLeft()
    {
        return m_left;
    }

    public Expr getRight()
    {
        return m_right;
    }

    @Override
    public ExprKind getKind()
    {
        return m_kind;
    }

    @Override
    int precedence()
    {
        switch (m_kind)
        {
        case IMPLIES:
            return PREC_IMPLIES;
        case IFF:
            return PREC_IFF;
        default:
            return PREC_EQ;
        }
    }

    @Override
    void print(StringBuilder sb)
    {
        String op;
        switch (m_kind)
        {
        case IMPLIES:
            op = " -> ";
            break;
        case IFF:
            op = " <-> ";
            break;
        case EQ:
            op = " = ";
            break;
        default:
            op = " != ";
        }
        int p = precedence();
        // implication associates to the right
        printOperand(sb, m_left, p + 1);
        sb.append(op);
        printOperand(sb, m_right, m_kind == ExprKind.IMPLIES ? p : p + 1);
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof BinaryExpr))
            return false;
        BinaryExpr other = (BinaryExpr) o;
        return m_kind == other.m_kind && m_left.equals(other.m_left) && m_right.equals(other.m_right);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(m_kind, m_left, m_right);
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Expr.java

Abstract:

Notes:
    
**/ 

package org.updr;

import org.updr.enumerations.ExprKind;

/**
 * Formulas and terms. The set of node classes is closed: every node is one
 * of {@link BoolLit}, {@link Id}, {@link AppExpr}, {@link UnaryExpr},
 * {@link NaryExpr}, {@link BinaryExpr}, {@link IteExpr} or
 * {@link QuantifierExpr}, identified by {@link #getKind()}. Traversals switch
 * on the kind. Equality is structural.
 **/
public abstract class Expr
{
    static final int PREC_QUANT = 0;
    static final int PREC_IFF = 1;
    static final int PREC_IMPLIES = 2;
    static final int PREC_OR = 3;
    static final int PREC_AND = 4;
    static final int PREC_EQ = 5;
    static final int PREC_NOT = 6;
    static final int PREC_ATOM = 7;

    Expr()
    {
    }

    /**
     * The kind of this node.
     **/
    public abstract ExprKind getKind();

    abstract int precedence();

    abstract void print(StringBuilder sb);

    static void printOperand(StringBuilder sb, Expr e, int minPrecedence)
    {
        if (e.precedence() < minPrecedence)
        {
            sb.append('(');
            e.print(sb);
            sb.append(')');
        }
        else
            e.print(sb);
    }

    /**
     * A string representation in the surface syntax, e.g.
     * {@code forall N1:node, N2:node. holds(N1) & holds(N2) -> N1 = N2}.
     **/
    @Override
    public final String toString()
    {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}

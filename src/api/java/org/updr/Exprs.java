/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Exprs.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import org.updr.enumerations.ExprKind;

/**
 * Factory methods and structural utilities for {@link Expr} trees.
 **/
public final class Exprs
{
    public static final BoolLit TRUE = new BoolLit(true);
    public static final BoolLit FALSE = new BoolLit(false);

    private Exprs()
    {
    }

    public static BoolLit bool(boolean value)
    {
        return value ? TRUE : FALSE;
    }

    public static Id id(String name)
    {
        return new Id(name);
    }

    /**
     * An application; without arguments this is the identifier {@code callee}.
     **/
    public static Expr app(String callee, Expr... args)
    {
        return app(callee, Arrays.asList(args));
    }

    public static Expr app(String callee, List<Expr> args)
    {
        if (args.isEmpty())
            return new Id(callee);
        return new AppExpr(callee, args);
    }

    public static Expr not(Expr e)
    {
        return new UnaryExpr(ExprKind.NOT, e);
    }

    public static Expr old(Expr e)
    {
        return new UnaryExpr(ExprKind.OLD, e);
    }

    /**
     * Conjunction; {@code true} for no operands and the operand itself for
     * one.
     **/
    public static Expr and(Expr... args)
    {
        return and(Arrays.asList(args));
    }

    public static Expr and(List<Expr> args)
    {
        return nary(ExprKind.AND, args, TRUE);
    }

    /**
     * Disjunction; {@code false} for no operands and the operand itself for
     * one.
     **/
    public static Expr or(Expr... args)
    {
        return or(Arrays.asList(args));
    }

    public static Expr or(List<Expr> args)
    {
        return nary(ExprKind.OR, args, FALSE);
    }

    private static Expr nary(ExprKind kind, List<Expr> args, Expr unit)
    {
        if (args.isEmpty())
            return unit;
        if (args.size() == 1)
            return args.get(0);
        return new NaryExpr(kind, args);
    }

    public static Expr implies(Expr left, Expr right)
    {
        return new BinaryExpr(ExprKind.IMPLIES, left, right);
    }

    public static Expr iff(Expr left, Expr right)
    {
        return new BinaryExpr(ExprKind.IFF, left, right);
    }

    public static Expr eq(Expr left, Expr right)
    {
        return new BinaryExpr(ExprKind.EQ, left, right);
    }

    public static Expr neq(Expr left, Expr right)
    {
        return new BinaryExpr(ExprKind.NEQ, left, right);
    }

    public static Expr ite(Expr cond, Expr thenBranch, Expr elseBranch)
    {
        return new IteExpr(cond, thenBranch, elseBranch);
    }

    /**
     * Universal quantification; the body itself when {@code vars} is empty.
     **/
    public static Expr forall(List<SortedVar> vars, Expr body)
    {
        return vars.isEmpty() ? body : new QuantifierExpr(ExprKind.FORALL, vars, body);
    }

    public static Expr forall(SortedVar var, Expr body)
    {
        return forall(Collections.singletonList(var), body);
    }

    /**
     * Existential quantification; the body itself when {@code vars} is empty.
     **/
    public static Expr exists(List<SortedVar> vars, Expr body)
    {
        return vars.isEmpty() ? body : new QuantifierExpr(ExprKind.EXISTS, vars, body);
    }

    public static Expr exists(SortedVar var, Expr body)
    {
        return exists(Collections.singletonList(var), body);
    }

    /**
     * The negation of {@code e}, removing a double negation and flipping
     * equalities and boolean literals.
     **/
    public static Expr negate(Expr e)
    {
        switch (e.getKind())
        {
        case BOOL_LITERAL:
            return bool(!((BoolLit) e).getValue());
        case NOT:
            return ((UnaryExpr) e).getArg();
        case EQ:
            return neq(((BinaryExpr) e).getLeft(), ((BinaryExpr) e).getRight());
        case NEQ:
            return eq(((BinaryExpr) e).getLeft(), ((BinaryExpr) e).getRight());
        default:
            return not(e);
        }
    }

    /**
     * The top-level conjuncts of {@code e}, flattening nested conjunctions.
     **/
    public static ImmutableList<Expr> conjuncts(Expr e)
    {
        ImmutableList.Builder<Expr> res = ImmutableList.builder();
        collectConjuncts(e, res);
        return res.build();
    }

    private static void collectConjuncts(Expr e, ImmutableList.Builder<Expr> res)
    {
        if (e.getKind() == ExprKind.AND)
        {
            for (Expr a : ((NaryExpr) e).getArgs())
                collectConjuncts(a, res);
        }
        else if (!e.equals(TRUE))
            res.add(e);
    }

    /**
     * Replaces free occurrences of identifiers by the mapped expressions.
     * Bound variables shadow the mapping inside their quantifier.
     **/
    public static Expr substitute(Expr e, Map<String, ? extends Expr> subst)
    {
        if (subst.isEmpty())
            return e;
        switch (e.getKind())
        {
        case BOOL_LITERAL:
            return e;
        case ID:
        {
            Expr r = subst.get(((Id) e).getName());
            return r != null ? r : e;
        }
        case APP:
        {
            AppExpr a = (AppExpr) e;
            return new AppExpr(a.getCallee(), substituteAll(a.getArgs(), subst));
        }
        case NOT:
        case OLD:
            return new UnaryExpr(e.getKind(), substitute(((UnaryExpr) e).getArg(), subst));
        case AND:
        case OR:
            return new NaryExpr(e.getKind(), substituteAll(((NaryExpr) e).getArgs(), subst));
        case IMPLIES:
        case IFF:
        case EQ:
        case NEQ:
        {
            BinaryExpr b = (BinaryExpr) e;
            return new BinaryExpr(e.getKind(), substitute(b.getLeft(), subst), substitute(b.getRight(), subst));
        }
        case ITE:
        {
            IteExpr i = (IteExpr) e;
            return new IteExpr(substitute(i.getCond(), subst), substitute(i.getThen(), subst),
                    substitute(i.getElse(), subst));
        }
        case FORALL:
        case EXISTS:
        {
            QuantifierExpr q = (QuantifierExpr) e;
            Map<String, Expr> inner = new HashMap<String, Expr>(subst);
            for (SortedVar v : q.getVars())
                inner.remove(v.getName());
            return new QuantifierExpr(e.getKind(), q.getVars(), substitute(q.getBody(), inner));
        }
        default:
            throw new IllegalStateException("unexpected kind " + e.getKind());
        }
    }

    private static List<Expr> substituteAll(List<Expr> args, Map<String, ? extends Expr> subst)
    {
        List<Expr> res = new ArrayList<Expr>(args.size());
        for (Expr a : args)
            res.add(substitute(a, subst));
        return res;
    }

    /**
     * Names of all identifiers and callees occurring free in {@code e}, in
     * order of first occurrence.
     **/
    public static Set<String> freeIds(Expr e)
    {
        Set<String> res = new LinkedHashSet<String>();
        collectFreeIds(e, Collections.<String>emptySet(), res);
        return res;
    }

    private static void collectFreeIds(Expr e, Set<String> bound, Set<String> res)
    {
        switch (e.getKind())
        {
        case BOOL_LITERAL:
            break;
        case ID:
            if (!bound.contains(((Id) e).getName()))
                res.add(((Id) e).getName());
            break;
        case APP:
            res.add(((AppExpr) e).getCallee());
            for (Expr a : ((AppExpr) e).getArgs())
                collectFreeIds(a, bound, res);
            break;
        case NOT:
        case OLD:
            collectFreeIds(((UnaryExpr) e).getArg(), bound, res);
            break;
        case AND:
        case OR:
            for (Expr a : ((NaryExpr) e).getArgs())
                collectFreeIds(a, bound, res);
            break;
        case IMPLIES:
        case IFF:
        case EQ:
        case NEQ:
            collectFreeIds(((BinaryExpr) e).getLeft(), bound, res);
            collectFreeIds(((BinaryExpr) e).getRight(), bound, res);
            break;
        case ITE:
            collectFreeIds(((IteExpr) e).getCond(), bound, res);
            collectFreeIds(((IteExpr) e).getThen(), bound, res);
            collectFreeIds(((IteExpr) e).getElse(), bound, res);
            break;
        case FORALL:
        case EXISTS:
        {
            QuantifierExpr q = (QuantifierExpr) e;
            Set<String> inner = new LinkedHashSet<String>(bound);
            for (SortedVar v : q.getVars())
                inner.add(v.getName());
            collectFreeIds(q.getBody(), inner, res);
            break;
        }
        default:
            throw new IllegalStateException("unexpected kind " + e.getKind());
        }
    }
}

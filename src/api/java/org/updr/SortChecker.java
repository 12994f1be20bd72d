/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    SortChecker.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves names and checks sorts of formulas against a vocabulary. Every
 * failure is reported as a {@link ProgramException} naming the formula's
 * context.
 **/
final class SortChecker
{
    private final Map<String, Sort> m_sorts;
    private final Map<String, SymbolDecl> m_symbols;

    SortChecker(Map<String, Sort> sorts, Map<String, SymbolDecl> symbols)
    {
        m_sorts = sorts;
        m_symbols = symbols;
    }

    /**
     * Checks that {@code e} is a formula whose free identifiers are declared
     * symbols or the given parameters.
     *
     * @param context description of the formula for error messages
     * @param twoState whether {@code old(..)} may occur
     * @param allowMutable whether mutable symbols may occur
     * @param params variables bound around the formula
     **/
    void checkFormula(Expr e, String context, boolean twoState, boolean allowMutable, List<SortedVar> params)
    {
        Map<String, Sort> env = new HashMap<String, Sort>();
        for (SortedVar v : params)
            checkVar(v, context, env);
        Sort s = check(e, new Ctx(context, twoState, allowMutable), env, false);
        if (!s.isBool())
            throw new ProgramException(context + ": expected a formula but found a term of sort " + s + ": " + e);
    }

    void checkFormula(Expr e, String context, boolean twoState, boolean allowMutable)
    {
        checkFormula(e, context, twoState, allowMutable, Collections.<SortedVar>emptyList());
    }

    private static final class Ctx
    {
        final String name;
        final boolean twoState;
        final boolean allowMutable;

        Ctx(String name, boolean twoState, boolean allowMutable)
        {
            this.name = name;
            this.twoState = twoState;
            this.allowMutable = allowMutable;
        }
    }

    private void checkVar(SortedVar v, String context, Map<String, Sort> env)
    {
        Sort declared = m_sorts.get(v.getSort().getName());
        if (declared == null || !declared.equals(v.getSort()))
            throw new ProgramException(context + ": variable " + v.getName() + " has undeclared sort " + v.getSort());
        if (m_symbols.containsKey(v.getName()))
            throw new ProgramException(context + ": variable " + v.getName() + " shadows a declared symbol");
        env.put(v.getName(), v.getSort());
    }

    private SymbolDecl symbol(String name, Ctx ctx)
    {
        SymbolDecl d = m_symbols.get(name);
        if (d == null)
            throw new ProgramException(ctx.name + ": unknown symbol " + name);
        if (d.isMutable() && !ctx.allowMutable)
            throw new ProgramException(ctx.name + ": mutable symbol " + name + " is not allowed here");
        return d;
    }

    private Sort expect(Sort expected, Expr e, Ctx ctx, Map<String, Sort> env, boolean inOld)
    {
        Sort s = check(e, ctx, env, inOld);
        if (!s.equals(expected))
            throw new ProgramException(ctx.name + ": expected sort " + expected + " but found " + s + " in " + e);
        return s;
    }

    private Sort check(Expr e, Ctx ctx, Map<String, Sort> env, boolean inOld)
    {
        switch (e.getKind())
        {
        case BOOL_LITERAL:
            return Sort.BOOL;
        case ID:
        {
            String name = ((Id) e).getName();
            Sort bound = env.get(name);
            if (bound != null)
                return bound;
            SymbolDecl d = symbol(name, ctx);
            if (d.getArity() != 0)
                throw new ProgramException(ctx.name + ": " + name + " expects " + d.getArity() + " arguments");
            return d.getRange();
        }
        case APP:
        {
            AppExpr a = (AppExpr) e;
            if (env.containsKey(a.getCallee()))
                throw new ProgramException(ctx.name + ": variable " + a.getCallee() + " applied to arguments");
            SymbolDecl d = symbol(a.getCallee(), ctx);
            if (d.getArity() != a.getArgs().size())
                throw new ProgramException(ctx.name + ": " + d.getName() + " expects " + d.getArity()
                        + " arguments but got " + a.getArgs().size());
            for (int i = 0; i < d.getArity(); i++)
                expect(d.getDomain().get(i), a.getArgs().get(i), ctx, env, inOld);
            return d.getRange();
        }
        case NOT:
            return expect(Sort.BOOL, ((UnaryExpr) e).getArg(), ctx, env, inOld);
        case OLD:
            if (!ctx.twoState)
                throw new ProgramException(ctx.name + ": old() is only allowed in transitions: " + e);
            if (inOld)
                throw new ProgramException(ctx.name + ": nested old(): " + e);
            return check(((UnaryExpr) e).getArg(), ctx, env, true);
        case AND:
        case OR:
            for (Expr a : ((NaryExpr) e).getArgs())
                expect(Sort.BOOL, a, ctx, env, inOld);
            return Sort.BOOL;
        case IMPLIES:
        case IFF:
            expect(Sort.BOOL, ((BinaryExpr) e).getLeft(), ctx, env, inOld);
            expect(Sort.BOOL, ((BinaryExpr) e).getRight(), ctx, env, inOld);
            return Sort.BOOL;
        case EQ:
        case NEQ:
        {
            Sort left = check(((BinaryExpr) e).getLeft(), ctx, env, inOld);
            expect(left, ((BinaryExpr) e).getRight(), ctx, env, inOld);
            return Sort.BOOL;
        }
        case ITE:
        {
            IteExpr i = (IteExpr) e;
            expect(Sort.BOOL, i.getCond(), ctx, env, inOld);
            Sort s = check(i.getThen(), ctx, env, inOld);
            return expect(s, i.getElse(), ctx, env, inOld);
        }
        case FORALL:
        case EXISTS:
        {
            QuantifierExpr q = (QuantifierExpr) e;
            Map<String, Sort> inner = new HashMap<String, Sort>(env);
            for (SortedVar v : q.getVars())
                checkVar(v, ctx.name, inner);
            return expect(Sort.BOOL, q.getBody(), ctx, inner, inOld);
        }
        default:
            throw new IllegalStateException("unexpected kind " + e.getKind());
        }
    }
}

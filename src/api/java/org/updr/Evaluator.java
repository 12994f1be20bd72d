/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Evaluator.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Evaluates formulas and terms on the finite structures of a {@link Trace}.
 * Formulas evaluate to {@link Boolean}, terms to element names.
 **/
final class Evaluator
{
    private final Trace m_trace;
    private final Program m_program;

    Evaluator(Trace trace)
    {
        m_trace = trace;
        m_program = trace.getProgram();
    }

    boolean eval(Expr formula, int state)
    {
        Object v = value(formula, state, new HashMap<String, String>());
        Preconditions.checkArgument(v instanceof Boolean, "not a formula: %s", formula);
        return (Boolean) v;
    }

    private boolean truth(Expr e, int state, Map<String, String> env)
    {
        Object v = value(e, state, env);
        Preconditions.checkState(v instanceof Boolean, "not a formula: %s", e);
        return (Boolean) v;
    }

    private SymbolDecl symbol(String name)
    {
        SymbolDecl d = m_program.getSymbol(name);
        Preconditions.checkState(d != null, "unresolved symbol %s", name);
        return d;
    }

    private Object value(Expr e, int state, Map<String, String> env)
    {
        switch (e.getKind())
        {
        case BOOL_LITERAL:
            return ((BoolLit) e).getValue();
        case ID:
        {
            String name = ((Id) e).getName();
            String bound = env.get(name);
            if (bound != null)
                return bound;
            return apply(symbol(name), state, new ArrayList<String>());
        }
        case APP:
        {
            AppExpr a = (AppExpr) e;
            List<String> args = new ArrayList<String>();
            for (Expr arg : a.getArgs())
                args.add((String) value(arg, state, env));
            return apply(symbol(a.getCallee()), state, args);
        }
        case NOT:
            return !truth(((UnaryExpr) e).getArg(), state, env);
        case OLD:
            Preconditions.checkState(state > 0, "old() in the first state: %s", e);
            return value(((UnaryExpr) e).getArg(), state - 1, env);
        case AND:
            for (Expr a : ((NaryExpr) e).getArgs())
                if (!truth(a, state, env))
                    return false;
            return true;
        case OR:
            for (Expr a : ((NaryExpr) e).getArgs())
                if (truth(a, state, env))
                    return true;
            return false;
        case IMPLIES:
            return !truth(((BinaryExpr) e).getLeft(), state, env) || truth(((BinaryExpr) e).getRight(), state, env);
        case IFF:
            return truth(((BinaryExpr) e).getLeft(), state, env) == truth(((BinaryExpr) e).getRight(), state, env);
        case EQ:
            return value(((BinaryExpr) e).getLeft(), state, env).equals(value(((BinaryExpr) e).getRight(), state, env));
        case NEQ:
            return !value(((BinaryExpr) e).getLeft(), state, env).equals(value(((BinaryExpr) e).getRight(), state, env));
        case ITE:
        {
            IteExpr i = (IteExpr) e;
            return truth(i.getCond(), state, env) ? value(i.getThen(), state, env) : value(i.getElse(), state, env);
        }
        case FORALL:
        case EXISTS:
        {
            QuantifierExpr q = (QuantifierExpr) e;
            List<List<String>> domains = new ArrayList<List<String>>();
            for (SortedVar v : q.getVars())
                domains.add(m_trace.getUniverse(v.getSort()));
            boolean forall = q.isForall();
            for (List<String> assignment : Lists.cartesianProduct(domains))
            {
                Map<String, String> inner = new HashMap<String, String>(env);
                for (int i = 0; i < assignment.size(); i++)
                    inner.put(q.getVars().get(i).getName(), assignment.get(i));
                if (truth(q.getBody(), state, inner) != forall)
                    return !forall;
            }
            return forall;
        }
        default:
            throw new IllegalStateException("unexpected kind " + e.getKind());
        }
    }

    private Object apply(SymbolDecl d, int state, List<String> args)
    {
        if (d instanceof RelationDecl)
            return m_trace.holds((RelationDecl) d, state, args);
        if (d instanceof ConstantDecl)
            return m_trace.constant((ConstantDecl) d, state);
        return m_trace.apply((FunctionDecl) d, state, args);
    }
}

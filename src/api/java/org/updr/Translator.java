/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Translator.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.UninterpretedSort;

import org.updr.enumerations.ExprKind;

/**
 * Translates formulas into Z3 terms over an ordered list of epoch keys. A
 * mutable symbol has one native copy per key; {@code old(e)} evaluates
 * {@code e} at the previous key. Immutable symbols are shared by all keys.
 **/
public final class Translator
{
    private final SolverSession m_session;
    private final Context m_ctx;
    private final Program m_program;
    private final ImmutableList<String> m_keys;

    Translator(SolverSession session, List<String> keys)
    {
        m_session = session;
        m_ctx = session.getContext();
        m_program = session.getProgram();
        m_keys = ImmutableList.copyOf(keys);
    }

    /**
     * The epoch keys, oldest first.
     **/
    public ImmutableList<String> getKeys()
    {
        return m_keys;
    }

    public Program getProgram()
    {
        return m_program;
    }

    /**
     * Translates a formula at the key with the given index.
     **/
    public BoolExpr translate(Expr formula, int index)
    {
        checkIndex(index);
        return formula(formula, index, new HashMap<String, com.microsoft.z3.Expr<UninterpretedSort>>());
    }

    /**
     * The formula relating the state at {@code newIndex - 1} to the state at
     * {@code newIndex} by one step of {@code t}: the body under its
     * existentially quantified parameters, plus equality of every mutable,
     * non-derived symbol that {@code t} does not modify.
     **/
    public BoolExpr translateTransition(TransitionDecl t, int newIndex)
    {
        checkIndex(newIndex);
        Preconditions.checkArgument(newIndex >= 1, "transition needs a pre-state key");
        Map<String, com.microsoft.z3.Expr<UninterpretedSort>> env =
                new HashMap<String, com.microsoft.z3.Expr<UninterpretedSort>>();
        com.microsoft.z3.Expr<?>[] params = bind(t.getParams(), env);

        List<BoolExpr> conj = new ArrayList<BoolExpr>();
        conj.add(formula(t.getBody(), newIndex, env));
        for (SymbolDecl d : m_program.getSymbols())
            if (d.isMutable() && !d.isDerived() && !t.modifies(d))
                conj.add(unchanged(d, newIndex));
        BoolExpr body = m_ctx.mkAnd(conj.toArray(new BoolExpr[conj.size()]));
        if (params.length == 0)
            return body;
        return m_ctx.mkExists(params, body, 0, null, null, null, null);
    }

    /**
     * The disjunction of all transitions of the program.
     **/
    public BoolExpr translateTransitions(int newIndex)
    {
        List<TransitionDecl> ts = m_program.getTransitions();
        BoolExpr[] res = new BoolExpr[ts.size()];
        for (int i = 0; i < res.length; i++)
            res[i] = translateTransition(ts.get(i), newIndex);
        return m_ctx.mkOr(res);
    }

    /**
     * {@code exists binder. and_k (trackers[k] <-> literals[k])}. Assuming a
     * subset of the trackers asserts the corresponding literals; the unsat
     * core then names the literals a refutation needed.
     **/
    public BoolExpr translateTracked(List<SortedVar> binder, List<Expr> literals, int index, BoolExpr[] trackers)
    {
        checkIndex(index);
        Preconditions.checkArgument(literals.size() == trackers.length, "one tracker per literal");
        Map<String, com.microsoft.z3.Expr<UninterpretedSort>> env =
                new HashMap<String, com.microsoft.z3.Expr<UninterpretedSort>>();
        com.microsoft.z3.Expr<?>[] bound = bind(binder, env);
        BoolExpr[] parts = new BoolExpr[trackers.length];
        for (int k = 0; k < parts.length; k++)
            parts[k] = m_ctx.mkIff(trackers[k], formula(literals.get(k), index, env));
        BoolExpr body = m_ctx.mkAnd(parts);
        if (bound.length == 0)
            return body;
        return m_ctx.mkExists(bound, body, 0, null, null, null, null);
    }

    FuncDecl<BoolSort> relation(RelationDecl r, int index)
    {
        return m_session.relation(m_keys.get(index), r);
    }

    FuncDecl<UninterpretedSort> term(SymbolDecl d, int index)
    {
        return m_session.term(m_keys.get(index), d);
    }

    UninterpretedSort sort(Sort s)
    {
        return m_session.sort(s);
    }

    Context getContext()
    {
        return m_ctx;
    }

    private void checkIndex(int index)
    {
        Preconditions.checkElementIndex(index, m_keys.size(), "key index");
    }

    private com.microsoft.z3.Expr<?>[] bind(List<SortedVar> vars,
            Map<String, com.microsoft.z3.Expr<UninterpretedSort>> env)
    {
        com.microsoft.z3.Expr<?>[] res = new com.microsoft.z3.Expr<?>[vars.size()];
        for (int i = 0; i < res.length; i++)
        {
            SortedVar v = vars.get(i);
            com.microsoft.z3.Expr<UninterpretedSort> c = m_ctx.mkFreshConst(v.getName(), sort(v.getSort()));
            env.put(v.getName(), c);
            res[i] = c;
        }
        return res;
    }

    private BoolExpr unchanged(SymbolDecl d, int newIndex)
    {
        com.microsoft.z3.Expr<?>[] xs = new com.microsoft.z3.Expr<?>[d.getArity()];
        for (int i = 0; i < xs.length; i++)
            xs[i] = m_ctx.mkFreshConst("X", sort(d.getDomain().get(i)));
        BoolExpr eq;
        if (d instanceof RelationDecl)
        {
            RelationDecl r = (RelationDecl) d;
            eq = m_ctx.mkIff(asFormula(relation(r, newIndex).apply(xs)), asFormula(relation(r, newIndex - 1).apply(xs)));
        }
        else
            eq = m_ctx.mkEq(term(d, newIndex).apply(xs), term(d, newIndex - 1).apply(xs));
        if (xs.length == 0)
            return eq;
        return m_ctx.mkForall(xs, eq, 0, null, null, null, null);
    }

    private SymbolDecl symbol(String name)
    {
        SymbolDecl d = m_program.getSymbol(name);
        Preconditions.checkState(d != null, "unresolved symbol %s", name);
        return d;
    }

    private BoolExpr formula(Expr e, int index, Map<String, com.microsoft.z3.Expr<UninterpretedSort>> env)
    {
        return asFormula(translate(e, index, env));
    }

    private com.microsoft.z3.Expr<?> translate(Expr e, int index,
            Map<String, com.microsoft.z3.Expr<UninterpretedSort>> env)
    {
        switch (e.getKind())
        {
        case BOOL_LITERAL:
            return m_ctx.mkBool(((BoolLit) e).getValue());
        case ID:
        {
            String name = ((Id) e).getName();
            com.microsoft.z3.Expr<UninterpretedSort> bound = env.get(name);
            if (bound != null)
                return bound;
            return apply(symbol(name), index);
        }
        case APP:
        {
            AppExpr a = (AppExpr) e;
            SymbolDecl d = symbol(a.getCallee());
            Preconditions.checkState(d.getArity() == a.getArgs().size(), "arity mismatch in %s", e);
            com.microsoft.z3.Expr<?>[] args = new com.microsoft.z3.Expr<?>[a.getArgs().size()];
            for (int i = 0; i < args.length; i++)
                args[i] = asTerm(translate(a.getArgs().get(i), index, env));
            return apply(d, index, args);
        }
        case NOT:
            return m_ctx.mkNot(formula(((UnaryExpr) e).getArg(), index, env));
        case OLD:
            Preconditions.checkState(index > 0, "old() at the first key: %s", e);
            return translate(((UnaryExpr) e).getArg(), index - 1, env);
        case AND:
        case OR:
        {
            List<Expr> args = ((NaryExpr) e).getArgs();
            BoolExpr[] fs = new BoolExpr[args.size()];
            for (int i = 0; i < fs.length; i++)
                fs[i] = formula(args.get(i), index, env);
            return e.getKind() == ExprKind.AND ? m_ctx.mkAnd(fs) : m_ctx.mkOr(fs);
        }
        case IMPLIES:
        {
            BinaryExpr b = (BinaryExpr) e;
            return m_ctx.mkImplies(formula(b.getLeft(), index, env), formula(b.getRight(), index, env));
        }
        case IFF:
        {
            BinaryExpr b = (BinaryExpr) e;
            return m_ctx.mkIff(formula(b.getLeft(), index, env), formula(b.getRight(), index, env));
        }
        case EQ:
        case NEQ:
        {
            BinaryExpr b = (BinaryExpr) e;
            com.microsoft.z3.Expr<?> l = translate(b.getLeft(), index, env);
            com.microsoft.z3.Expr<?> r = translate(b.getRight(), index, env);
            BoolExpr eq;
            if (l instanceof BoolExpr)
                eq = m_ctx.mkIff(asFormula(l), asFormula(r));
            else
                eq = m_ctx.mkEq(asTerm(l), asTerm(r));
            return e.getKind() == ExprKind.EQ ? eq : m_ctx.mkNot(eq);
        }
        case ITE:
        {
            IteExpr i = (IteExpr) e;
            BoolExpr c = formula(i.getCond(), index, env);
            com.microsoft.z3.Expr<?> t = translate(i.getThen(), index, env);
            com.microsoft.z3.Expr<?> f = translate(i.getElse(), index, env);
            if (t instanceof BoolExpr)
                return m_ctx.mkITE(c, asFormula(t), asFormula(f));
            return m_ctx.mkITE(c, asTerm(t), asTerm(f));
        }
        case FORALL:
        case EXISTS:
        {
            QuantifierExpr q = (QuantifierExpr) e;
            Map<String, com.microsoft.z3.Expr<UninterpretedSort>> inner =
                    new HashMap<String, com.microsoft.z3.Expr<UninterpretedSort>>(env);
            com.microsoft.z3.Expr<?>[] bound = bind(q.getVars(), inner);
            BoolExpr body = formula(q.getBody(), index, inner);
            if (q.isForall())
                return m_ctx.mkForall(bound, body, 0, null, null, null, null);
            return m_ctx.mkExists(bound, body, 0, null, null, null, null);
        }
        default:
            throw new IllegalStateException("unexpected kind " + e.getKind());
        }
    }

    private com.microsoft.z3.Expr<?> apply(SymbolDecl d, int index, com.microsoft.z3.Expr<?>... args)
    {
        if (d.isMutable())
            checkIndex(index);
        if (d instanceof RelationDecl)
            return relation((RelationDecl) d, index).apply(args);
        return term(d, index).apply(args);
    }

    static BoolExpr asFormula(com.microsoft.z3.Expr<?> e)
    {
        Preconditions.checkState(e instanceof BoolExpr, "expected a formula: %s", e);
        return (BoolExpr) e;
    }

    @SuppressWarnings("unchecked")
    static com.microsoft.z3.Expr<UninterpretedSort> asTerm(com.microsoft.z3.Expr<?> e)
    {
        Preconditions.checkState(!(e instanceof BoolExpr), "expected a term: %s", e);
        return (com.microsoft.z3.Expr<UninterpretedSort>) e;
    }
}

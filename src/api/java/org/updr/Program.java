/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Program.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;

/**
 * An immutable, sort-checked transition system: sorts, symbols, axioms,
 * initial conditions, transitions and invariants. Programs are assembled
 * with {@link #builder()}.
 **/
public final class Program
{
    private final ImmutableMap<String, Sort> m_sorts;
    private final ImmutableMap<String, SymbolDecl> m_symbols;
    private final ImmutableList<Expr> m_axioms;
    private final ImmutableList<Expr> m_inits;
    private final ImmutableList<InvariantDecl> m_invariants;
    private final ImmutableMap<String, TransitionDecl> m_transitions;
    private String m_fingerprint;

    private Program(Builder b)
    {
        m_sorts = ImmutableMap.copyOf(b.m_sorts);
        m_symbols = ImmutableMap.copyOf(b.m_symbols);
        m_axioms = ImmutableList.copyOf(b.m_axioms);
        m_inits = ImmutableList.copyOf(b.m_inits);
        m_invariants = ImmutableList.copyOf(b.m_invariants);
        m_transitions = ImmutableMap.copyOf(b.m_transitions);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * The declared sorts, in declaration order.
     **/
    public ImmutableList<Sort> getSorts()
    {
        return m_sorts.values().asList();
    }

    /**
     * The sort with the given name, or null.
     **/
    public Sort getSort(String name)
    {
        return m_sorts.get(name);
    }

    /**
     * All declared symbols, in declaration order.
     **/
    public ImmutableList<SymbolDecl> getSymbols()
    {
        return m_symbols.values().asList();
    }

    /**
     * The symbol with the given name, or null.
     **/
    public SymbolDecl getSymbol(String name)
    {
        return m_symbols.get(name);
    }

    public List<RelationDecl> getRelations()
    {
        List<RelationDecl> res = new ArrayList<RelationDecl>();
        for (SymbolDecl d : m_symbols.values())
            if (d instanceof RelationDecl)
                res.add((RelationDecl) d);
        return res;
    }

    public List<ConstantDecl> getConstants()
    {
        List<ConstantDecl> res = new ArrayList<ConstantDecl>();
        for (SymbolDecl d : m_symbols.values())
            if (d instanceof ConstantDecl)
                res.add((ConstantDecl) d);
        return res;
    }

    public List<FunctionDecl> getFunctions()
    {
        List<FunctionDecl> res = new ArrayList<FunctionDecl>();
        for (SymbolDecl d : m_symbols.values())
            if (d instanceof FunctionDecl)
                res.add((FunctionDecl) d);
        return res;
    }

    /**
     * The relations whose interpretation is fixed by a defining axiom.
     **/
    public List<RelationDecl> getDerivedRelations()
    {
        List<RelationDecl> res = new ArrayList<RelationDecl>();
        for (RelationDecl r : getRelations())
            if (r.isDerived())
                res.add(r);
        return res;
    }

    public ImmutableList<Expr> getAxioms()
    {
        return m_axioms;
    }

    /**
     * The conjuncts of the initial condition.
     **/
    public ImmutableList<Expr> getInits()
    {
        return m_inits;
    }

    public ImmutableList<InvariantDecl> getInvariants()
    {
        return m_invariants;
    }

    /**
     * The formulas of the safety invariants.
     **/
    public ImmutableList<Expr> getSafeties()
    {
        ImmutableList.Builder<Expr> res = ImmutableList.builder();
        for (InvariantDecl inv : m_invariants)
            if (inv.isSafety())
                res.add(inv.getExpr());
        return res.build();
    }

    /**
     * The conjunction of all safety invariants.
     **/
    public Expr getSafety()
    {
        return Exprs.and(getSafeties());
    }

    public ImmutableList<TransitionDecl> getTransitions()
    {
        return m_transitions.values().asList();
    }

    /**
     * The transition with the given name, or null.
     **/
    public TransitionDecl getTransition(String name)
    {
        return m_transitions.get(name);
    }

    /**
     * Sort-checks a one-state formula against this program's vocabulary,
     * e.g. a formula read back from a checkpoint.
     *
     * @throws ProgramException if the formula is not well-sorted
     **/
    public void checkFormula(Expr e, String context)
    {
        new SortChecker(m_sorts, m_symbols).checkFormula(e, context, false, true);
    }

    /**
     * A SHA-256 digest of the printed program. Checkpoints are keyed by it.
     **/
    public synchronized String fingerprint()
    {
        if (m_fingerprint == null)
            m_fingerprint = Hashing.sha256().hashString(toString(), StandardCharsets.UTF_8).toString();
        return m_fingerprint;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        for (Sort s : m_sorts.values())
            sb.append("sort ").append(s).append('\n');
        for (SymbolDecl d : m_symbols.values())
        {
            sb.append(d.isMutable() ? "mutable " : "immutable ");
            switch (d.getKind())
            {
            case RELATION:
                sb.append("relation ");
                break;
            case CONSTANT:
                sb.append("constant ");
                break;
            default:
                sb.append("function ");
            }
            sb.append(d.getName());
            if (d.getArity() > 0)
                sb.append('(').append(Joiner.on(", ").join(d.getDomain())).append(')');
            if (!d.getRange().isBool())
                sb.append(": ").append(d.getRange());
            sb.append('\n');
            if (d.isDerived())
                sb.append("  derived by ").append(((RelationDecl) d).getDerivedAxiom()).append('\n');
        }
        for (Expr a : m_axioms)
            sb.append("axiom ").append(a).append('\n');
        for (Expr i : m_inits)
            sb.append("init ").append(i).append('\n');
        for (TransitionDecl t : m_transitions.values())
            sb.append(t).append('\n');
        for (InvariantDecl inv : m_invariants)
            sb.append(inv).append('\n');
        return sb.toString();
    }

    /**
     * Collects declarations and formulas. {@link #build()} sort-checks
     * everything; declaration errors are reported immediately.
     **/
    public static final class Builder
    {
        private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

        private final Map<String, Sort> m_sorts = new LinkedHashMap<String, Sort>();
        private final Map<String, SymbolDecl> m_symbols = new LinkedHashMap<String, SymbolDecl>();
        private final List<Expr> m_axioms = new ArrayList<Expr>();
        private final List<Expr> m_inits = new ArrayList<Expr>();
        private final List<InvariantDecl> m_invariants = new ArrayList<InvariantDecl>();
        private final Map<String, TransitionDecl> m_transitions = new LinkedHashMap<String, TransitionDecl>();

        private Builder()
        {
        }

        public Sort declareSort(String name)
        {
            checkIdentifier("sort", name);
            if (m_sorts.containsKey(name) || name.equals(Sort.BOOL.getName()))
                throw new ProgramException("duplicate sort " + name);
            Sort s = new Sort(name);
            m_sorts.put(name, s);
            return s;
        }

        public RelationDecl declareRelation(String name, boolean mutable, Sort... domain)
        {
            return add(new RelationDecl(name, mutable, checkSorts(name, domain), null));
        }

        /**
         * Declares a mutable relation defined by {@code axiom}, a closed
         * one-state formula that may mention the relation and other mutable
         * symbols.
         **/
        public RelationDecl declareDerivedRelation(String name, Expr axiom, Sort... domain)
        {
            if (axiom == null)
                throw new ProgramException("derived relation " + name + " needs a defining axiom");
            return add(new RelationDecl(name, true, checkSorts(name, domain), axiom));
        }

        public ConstantDecl declareConstant(String name, boolean mutable, Sort sort)
        {
            checkSorts(name, sort);
            return add(new ConstantDecl(name, mutable, sort));
        }

        public FunctionDecl declareFunction(String name, boolean mutable, Sort range, Sort... domain)
        {
            checkSorts(name, range);
            if (domain.length == 0)
                throw new ProgramException("function " + name + " needs arguments; declare a constant instead");
            return add(new FunctionDecl(name, mutable, checkSorts(name, domain), range));
        }

        public Builder addAxiom(Expr axiom)
        {
            m_axioms.add(axiom);
            return this;
        }

        /**
         * Adds the conjuncts of {@code init} to the initial condition.
         **/
        public Builder addInit(Expr init)
        {
            m_inits.addAll(Exprs.conjuncts(init));
            return this;
        }

        public Builder addSafety(String name, Expr safety)
        {
            m_invariants.add(new InvariantDecl(name, safety, true));
            return this;
        }

        public Builder addSafety(Expr safety)
        {
            return addSafety(null, safety);
        }

        public Builder addInvariant(String name, Expr invariant)
        {
            m_invariants.add(new InvariantDecl(name, invariant, false));
            return this;
        }

        public Builder addTransition(String name, List<SortedVar> params, List<String> mods, Expr body)
        {
            if (m_transitions.containsKey(name))
                throw new ProgramException("duplicate transition " + name);
            m_transitions.put(name, new TransitionDecl(name, params, mods, body));
            return this;
        }

        public Builder addTransition(String name, List<SortedVar> params, Expr body, String... mods)
        {
            return addTransition(name, params, Arrays.asList(mods), body);
        }

        /**
         * Sort-checks all formulas and returns the program.
         *
         * @throws ProgramException if a formula or a transition's modifies
         *         clause is invalid
         **/
        public Program build()
        {
            SortChecker checker = new SortChecker(m_sorts, m_symbols);
            for (SymbolDecl d : m_symbols.values())
                if (d.isDerived())
                    checker.checkFormula(((RelationDecl) d).getDerivedAxiom(), "definition of " + d.getName(),
                            false, true);
            for (Expr a : m_axioms)
                checker.checkFormula(a, "axiom " + a, false, false);
            for (Expr i : m_inits)
                checker.checkFormula(i, "init " + i, false, true);
            for (TransitionDecl t : m_transitions.values())
            {
                checkMods(t);
                checker.checkFormula(t.getBody(), "transition " + t.getName(), true, true, t.getParams());
            }
            for (InvariantDecl inv : m_invariants)
                checker.checkFormula(inv.getExpr(), inv.toString(), false, true);
            return new Program(this);
        }

        private void checkMods(TransitionDecl t)
        {
            Set<String> seen = new HashSet<String>();
            Set<String> params = new HashSet<String>();
            for (SortedVar v : t.getParams())
                if (!params.add(v.getName()))
                    throw new ProgramException("transition " + t.getName() + ": duplicate parameter " + v.getName());
            for (String m : t.getMods())
            {
                if (!seen.add(m))
                    throw new ProgramException("transition " + t.getName() + ": duplicate modifies entry " + m);
                SymbolDecl d = m_symbols.get(m);
                if (d == null)
                    throw new ProgramException("transition " + t.getName() + " modifies unknown symbol " + m);
                if (!d.isMutable())
                    throw new ProgramException("transition " + t.getName() + " modifies immutable symbol " + m);
                if (d.isDerived())
                    throw new ProgramException("transition " + t.getName() + " modifies derived relation " + m);
            }
        }

        private <T extends SymbolDecl> T add(T d)
        {
            checkIdentifier("symbol", d.getName());
            if (m_symbols.containsKey(d.getName()) || m_sorts.containsKey(d.getName()))
                throw new ProgramException("duplicate symbol " + d.getName());
            m_symbols.put(d.getName(), d);
            return d;
        }

        /**
         * Names are letters, digits and underscores. The solver relies on
         * this to keep the names of state copies apart from immutable ones.
         **/
        private static void checkIdentifier(String what, String name)
        {
            if (name == null || !IDENTIFIER.matcher(name).matches())
                throw new ProgramException("invalid " + what + " name '" + name + "'");
        }

        private List<Sort> checkSorts(String symbol, Sort... sorts)
        {
            for (Sort s : sorts)
                if (s == null || !s.equals(m_sorts.get(s.getName())))
                    throw new ProgramException(symbol + ": undeclared sort " + s);
            return Collections.unmodifiableList(Arrays.asList(sorts));
        }
    }
}

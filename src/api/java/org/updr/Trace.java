/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Trace.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.UninterpretedSort;

/**
 * A finite first-order structure for each epoch key of a query, read out
 * of a Z3 model. Elements are renamed {@code <SORT><i>}, so traces are
 * independent of the solver that produced them.
 **/
public final class Trace
{
    /**
     * Interpretation of the symbols of one state, or of the immutable
     * symbols.
     **/
    static final class Interpretation
    {
        final Map<String, Set<List<String>>> relations = new LinkedHashMap<String, Set<List<String>>>();
        final Map<String, String> constants = new LinkedHashMap<String, String>();
        final Map<String, Map<List<String>, String>> functions = new LinkedHashMap<String, Map<List<String>, String>>();
    }

    private final Program m_program;
    private final ImmutableList<String> m_keys;
    private final ImmutableMap<Sort, ImmutableList<String>> m_universes;
    private final Interpretation m_immutable;
    private final ImmutableList<Interpretation> m_states;
    private final List<String> m_transitions;

    Trace(Program program, List<String> keys, Map<Sort, ImmutableList<String>> universes, Interpretation immutable,
            List<Interpretation> states, List<String> transitions)
    {
        Preconditions.checkArgument(keys.size() == states.size(), "one interpretation per key");
        Preconditions.checkArgument(transitions.size() == Math.max(0, keys.size() - 1), "one transition per step");
        m_program = program;
        m_keys = ImmutableList.copyOf(keys);
        m_universes = ImmutableMap.copyOf(universes);
        m_immutable = immutable;
        m_states = ImmutableList.copyOf(states);
        m_transitions = Collections.unmodifiableList(new ArrayList<String>(transitions));
    }

    /**
     * Reads the universes and the interpretation of every symbol at every
     * key of {@code t} out of {@code model}, using model completion.
     **/
    public static Trace fromZ3(Translator t, Model model)
    {
        Program program = t.getProgram();
        Context ctx = t.getContext();
        List<com.microsoft.z3.Sort> modelSorts = Arrays.asList(model.getSorts());

        Map<Sort, ImmutableList<String>> universes = new LinkedHashMap<Sort, ImmutableList<String>>();
        Map<Sort, List<com.microsoft.z3.Expr<UninterpretedSort>>> elements =
                new HashMap<Sort, List<com.microsoft.z3.Expr<UninterpretedSort>>>();
        Map<String, String> names = new HashMap<String, String>();
        Set<String> taken = new HashSet<String>();
        for (Sort s : program.getSorts())
        {
            UninterpretedSort z = t.sort(s);
            List<com.microsoft.z3.Expr<UninterpretedSort>> elems;
            if (modelSorts.contains(z))
                elems = Arrays.asList(model.getSortUniverse(z));
            else
                elems = Collections.singletonList(model.eval(ctx.mkFreshConst("elem", z), true));
            ImmutableList.Builder<String> u = ImmutableList.builder();
            for (int i = 0; i < elems.size(); i++)
            {
                String name = elementName(program, s, i, taken);
                names.put(elems.get(i).toString(), name);
                u.add(name);
            }
            universes.put(s, u.build());
            elements.put(s, elems);
        }

        Interpretation immutable = new Interpretation();
        List<Interpretation> states = new ArrayList<Interpretation>();
        for (int i = 0; i < t.getKeys().size(); i++)
            states.add(new Interpretation());
        for (SymbolDecl d : program.getSymbols())
        {
            if (d.isMutable())
            {
                for (int i = 0; i < states.size(); i++)
                    read(t, model, d, i, elements, names, states.get(i));
            }
            else
                read(t, model, d, 0, elements, names, immutable);
        }
        return new Trace(program, t.getKeys(), universes, immutable, states,
                Collections.<String>nCopies(Math.max(0, states.size() - 1), null));
    }

    private static void read(Translator t, Model model, SymbolDecl d, int index,
            Map<Sort, List<com.microsoft.z3.Expr<UninterpretedSort>>> elements, Map<String, String> names,
            Interpretation target)
    {
        List<List<com.microsoft.z3.Expr<UninterpretedSort>>> domain =
                new ArrayList<List<com.microsoft.z3.Expr<UninterpretedSort>>>();
        for (Sort s : d.getDomain())
            domain.add(elements.get(s));
        List<List<com.microsoft.z3.Expr<UninterpretedSort>>> tuples = Lists.cartesianProduct(domain);
        if (d instanceof RelationDecl)
        {
            Set<List<String>> rel = new LinkedHashSet<List<String>>();
            for (List<com.microsoft.z3.Expr<UninterpretedSort>> args : tuples)
            {
                com.microsoft.z3.Expr<?>[] a = args.toArray(new com.microsoft.z3.Expr<?>[args.size()]);
                BoolExpr v = Translator.asFormula(model.eval(t.relation((RelationDecl) d, index).apply(a), true));
                if (v.isTrue())
                    rel.add(elementNames(args, names));
                else
                    Preconditions.checkState(v.isFalse(), "no value for %s in the model", d);
            }
            target.relations.put(d.getName(), rel);
        }
        else if (d.getArity() == 0)
            target.constants.put(d.getName(), value(model, t.term(d, index).apply(), names, d));
        else
        {
            Map<List<String>, String> fun = new LinkedHashMap<List<String>, String>();
            for (List<com.microsoft.z3.Expr<UninterpretedSort>> args : tuples)
            {
                com.microsoft.z3.Expr<?>[] a = args.toArray(new com.microsoft.z3.Expr<?>[args.size()]);
                fun.put(elementNames(args, names), value(model, t.term(d, index).apply(a), names, d));
            }
            target.functions.put(d.getName(), fun);
        }
    }

    private static String value(Model model, com.microsoft.z3.Expr<UninterpretedSort> e, Map<String, String> names,
            SymbolDecl d)
    {
        String name = names.get(model.eval(e, true).toString());
        Preconditions.checkState(name != null, "value of %s is outside the universe", d);
        return name;
    }

    private static List<String> elementNames(List<com.microsoft.z3.Expr<UninterpretedSort>> args,
            Map<String, String> names)
    {
        List<String> res = new ArrayList<String>(args.size());
        for (com.microsoft.z3.Expr<UninterpretedSort> a : args)
            res.add(names.get(a.toString()));
        return Collections.unmodifiableList(res);
    }

    /**
     * {@code <SORT><i>}, extended with underscores until it names neither a
     * declared symbol or sort nor an element already in {@code taken}.
     * Diagram variables carry these names.
     **/
    static String elementName(Program program, Sort s, int i, Set<String> taken)
    {
        String name = s.getName().toUpperCase(Locale.ROOT) + i;
        while (taken.contains(name) || program.getSymbol(name) != null || program.getSort(name) != null)
            name = name + "_";
        taken.add(name);
        return name;
    }

    /**
     * This trace with the names of the transitions taken between consecutive
     * states.
     **/
    public Trace withTransitions(List<String> transitions)
    {
        return new Trace(m_program, m_keys, m_universes, m_immutable, m_states, transitions);
    }

    public Program getProgram()
    {
        return m_program;
    }

    public ImmutableList<String> getKeys()
    {
        return m_keys;
    }

    public int getNumStates()
    {
        return m_states.size();
    }

    /**
     * The transitions between consecutive states; entries are null where
     * unknown.
     **/
    public List<String> getTransitions()
    {
        return m_transitions;
    }

    public ImmutableList<String> getUniverse(Sort s)
    {
        ImmutableList<String> u = m_universes.get(s);
        Preconditions.checkArgument(u != null, "unknown sort %s", s);
        return u;
    }

    private Interpretation interpretation(SymbolDecl d, int state)
    {
        if (!d.isMutable())
            return m_immutable;
        Preconditions.checkElementIndex(state, m_states.size(), "state");
        return m_states.get(state);
    }

    /**
     * Whether relation {@code r} holds of {@code args} in the given state.
     **/
    public boolean holds(RelationDecl r, int state, List<String> args)
    {
        Set<List<String>> rel = interpretation(r, state).relations.get(r.getName());
        Preconditions.checkArgument(rel != null, "no interpretation of %s", r);
        return rel.contains(args);
    }

    public String constant(ConstantDecl c, int state)
    {
        String v = interpretation(c, state).constants.get(c.getName());
        Preconditions.checkArgument(v != null, "no interpretation of %s", c);
        return v;
    }

    public String apply(FunctionDecl f, int state, List<String> args)
    {
        Map<List<String>, String> fun = interpretation(f, state).functions.get(f.getName());
        Preconditions.checkArgument(fun != null, "no interpretation of %s", f);
        String v = fun.get(args);
        Preconditions.checkArgument(v != null, "%s is not defined on %s", f, args);
        return v;
    }

    /**
     * Whether the mutable symbol {@code d} has the same interpretation in
     * {@code state} as in the state before it.
     **/
    public boolean isUnchanged(SymbolDecl d, int state)
    {
        Preconditions.checkArgument(d.isMutable(), "%s is immutable", d);
        Preconditions.checkArgument(state > 0 && state < m_states.size(), "no state before %s", state);
        Interpretation before = m_states.get(state - 1);
        Interpretation after = m_states.get(state);
        switch (d.getKind())
        {
        case RELATION:
            return before.relations.get(d.getName()).equals(after.relations.get(d.getName()));
        case CONSTANT:
            return before.constants.get(d.getName()).equals(after.constants.get(d.getName()));
        default:
            return before.functions.get(d.getName()).equals(after.functions.get(d.getName()));
        }
    }

    /**
     * Evaluates a formula in the given state; {@code old(..)} refers to the
     * state before it.
     **/
    public boolean eval(Expr formula, int state)
    {
        return new Evaluator(this).eval(formula, state);
    }

    /**
     * The diagram of the given state: one variable per element, their
     * pairwise distinctness, and every ground literal over them. With
     * {@code simplify}, variables equal to a constant are replaced by it.
     **/
    public Diagram asDiagram(int state, boolean simplify)
    {
        Preconditions.checkElementIndex(state, m_states.size(), "state");
        List<SortedVar> vars = new ArrayList<SortedVar>();
        List<Expr> conjuncts = new ArrayList<Expr>();
        for (Map.Entry<Sort, ImmutableList<String>> e : m_universes.entrySet())
        {
            List<String> u = e.getValue();
            for (String x : u)
                vars.add(new SortedVar(x, e.getKey()));
            for (int i = 0; i < u.size(); i++)
                for (int j = i + 1; j < u.size(); j++)
                    conjuncts.add(Exprs.neq(Exprs.id(u.get(i)), Exprs.id(u.get(j))));
        }
        for (RelationDecl r : m_program.getRelations())
        {
            if (r.isDerived())
                continue;
            for (List<String> args : tuples(r))
            {
                Expr atom = Exprs.app(r.getName(), ids(args));
                conjuncts.add(holds(r, state, args) ? atom : Exprs.not(atom));
            }
        }
        for (ConstantDecl c : m_program.getConstants())
            conjuncts.add(Exprs.eq(Exprs.id(c.getName()), Exprs.id(constant(c, state))));
        for (FunctionDecl f : m_program.getFunctions())
            for (List<String> args : tuples(f))
                conjuncts.add(Exprs.eq(Exprs.app(f.getName(), ids(args)), Exprs.id(apply(f, state, args))));
        Diagram d = new Diagram(m_program, vars, conjuncts);
        if (simplify)
            d.simplifyConsts();
        return d;
    }

    List<List<String>> tuples(SymbolDecl d)
    {
        List<List<String>> domain = new ArrayList<List<String>>();
        for (Sort s : d.getDomain())
            domain.add(getUniverse(s));
        return Lists.cartesianProduct(domain);
    }

    private static List<Expr> ids(List<String> names)
    {
        List<Expr> res = new ArrayList<Expr>(names.size());
        for (String n : names)
            res.add(Exprs.id(n));
        return res;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Sort, ImmutableList<String>> e : m_universes.entrySet())
            sb.append("sort ").append(e.getKey()).append(": ").append(Joiner.on(", ").join(e.getValue())).append('\n');
        print(sb, m_immutable, "");
        for (int i = 0; i < m_states.size(); i++)
        {
            if (i > 0)
                sb.append("transition ").append(m_transitions.get(i - 1) == null ? "?" : m_transitions.get(i - 1))
                        .append('\n');
            sb.append("state ").append(i).append(" (").append(m_keys.get(i)).append("):\n");
            print(sb, m_states.get(i), "  ");
        }
        return sb.toString();
    }

    private static void print(StringBuilder sb, Interpretation interp, String indent)
    {
        for (Map.Entry<String, Set<List<String>>> e : interp.relations.entrySet())
        {
            sb.append(indent).append(e.getKey()).append(" = {");
            List<String> tuples = new ArrayList<String>();
            for (List<String> t : e.getValue())
                tuples.add("(" + Joiner.on(", ").join(t) + ")");
            sb.append(Joiner.on(", ").join(tuples)).append("}\n");
        }
        for (Map.Entry<String, String> e : interp.constants.entrySet())
            sb.append(indent).append(e.getKey()).append(" = ").append(e.getValue()).append('\n');
        for (Map.Entry<String, Map<List<String>, String>> e : interp.functions.entrySet())
            for (Map.Entry<List<String>, String> v : e.getValue().entrySet())
                sb.append(indent).append(e.getKey()).append('(').append(Joiner.on(", ").join(v.getKey()))
                        .append(") = ").append(v.getValue()).append('\n');
    }

    Interpretation getImmutable()
    {
        return m_immutable;
    }

    Interpretation getState(int i)
    {
        return m_states.get(i);
    }

    ImmutableMap<Sort, ImmutableList<String>> getUniverses()
    {
        return m_universes;
    }
}

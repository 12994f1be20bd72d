/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Diagram.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.updr.enumerations.DiagramGroupKind;
import org.updr.enumerations.ExprKind;

/**
 * An existentially quantified conjunction of literals describing a state
 * up to isomorphism. Literals are grouped by the declaration they
 * constrain; generalization removes literals, which are kept in place and
 * only marked inactive.
 **/
public final class Diagram
{
    /**
     * The declaration a literal constrains.
     **/
    public static final class Group
    {
        private final DiagramGroupKind m_kind;
        private final String m_name;

        Group(DiagramGroupKind kind, String name)
        {
            m_kind = kind;
            m_name = name;
        }

        public DiagramGroupKind getKind()
        {
            return m_kind;
        }

        /**
         * The sort name for inequalities, the symbol name otherwise.
         **/
        public String getName()
        {
            return m_name;
        }

        @Override
        public boolean equals(Object o)
        {
            if (!(o instanceof Group))
                return false;
            Group other = (Group) o;
            return m_kind == other.m_kind && m_name.equals(other.m_name);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(m_kind, m_name);
        }

        @Override
        public String toString()
        {
            return m_kind.toString().toLowerCase() + " " + m_name;
        }
    }

    private final Program m_program;
    private List<SortedVar> m_vars;
    private List<Expr> m_conjuncts;
    private List<Group> m_groups;
    private final BitSet m_removed;

    /**
     * Creates a diagram with all literals active.
     *
     * @throws IllegalArgumentException if a conjunct is not a diagram
     *         literal over {@code vars} and the program's symbols
     **/
    public Diagram(Program program, List<SortedVar> vars, List<Expr> conjuncts)
    {
        m_program = program;
        m_vars = new ArrayList<SortedVar>(vars);
        m_conjuncts = new ArrayList<Expr>(conjuncts);
        m_groups = new ArrayList<Group>(conjuncts.size());
        for (Expr c : conjuncts)
            m_groups.add(classify(c));
        m_removed = new BitSet();
    }

    private Diagram(Diagram other)
    {
        m_program = other.m_program;
        m_vars = new ArrayList<SortedVar>(other.m_vars);
        m_conjuncts = new ArrayList<Expr>(other.m_conjuncts);
        m_groups = new ArrayList<Group>(other.m_groups);
        m_removed = (BitSet) other.m_removed.clone();
    }

    public Diagram copy()
    {
        return new Diagram(this);
    }

    private Sort sortOf(Expr term)
    {
        if (term.getKind() == ExprKind.ID)
        {
            String name = ((Id) term).getName();
            for (SortedVar v : m_vars)
                if (v.getName().equals(name))
                    return v.getSort();
            SymbolDecl d = m_program.getSymbol(name);
            if (d instanceof ConstantDecl)
                return d.getRange();
        }
        else if (term.getKind() == ExprKind.APP)
        {
            SymbolDecl d = m_program.getSymbol(((AppExpr) term).getCallee());
            if (d instanceof FunctionDecl)
                return d.getRange();
        }
        throw new IllegalArgumentException("not a diagram term: " + term);
    }

    private Group classify(Expr c)
    {
        switch (c.getKind())
        {
        case NEQ:
            return new Group(DiagramGroupKind.INEQUALITY, sortOf(((BinaryExpr) c).getLeft()).getName());
        case EQ:
        {
            Expr left = ((BinaryExpr) c).getLeft();
            if (left.getKind() == ExprKind.ID && m_program.getSymbol(((Id) left).getName()) instanceof ConstantDecl)
                return new Group(DiagramGroupKind.CONSTANT, ((Id) left).getName());
            if (left.getKind() == ExprKind.APP
                    && m_program.getSymbol(((AppExpr) left).getCallee()) instanceof FunctionDecl)
                return new Group(DiagramGroupKind.FUNCTION, ((AppExpr) left).getCallee());
            break;
        }
        case NOT:
        case ID:
        case APP:
        {
            String name = atomName(c.getKind() == ExprKind.NOT ? ((UnaryExpr) c).getArg() : c);
            if (name != null && m_program.getSymbol(name) instanceof RelationDecl)
                return new Group(DiagramGroupKind.RELATION, name);
            break;
        }
        default:
            break;
        }
        throw new IllegalArgumentException("not a diagram literal: " + c);
    }

    private static String atomName(Expr e)
    {
        if (e.getKind() == ExprKind.ID)
            return ((Id) e).getName();
        if (e.getKind() == ExprKind.APP)
            return ((AppExpr) e).getCallee();
        return null;
    }

    /**
     * Replaces every variable {@code X} with a literal {@code c = X} by the
     * constant {@code c}, removing {@code X} from the binder and dropping
     * literals that become {@code c = c}. Must be called before any literal
     * is removed.
     **/
    public void simplifyConsts()
    {
        Preconditions.checkState(m_removed.isEmpty(), "simplify before generalizing");
        Set<String> varNames = new LinkedHashSet<String>();
        for (SortedVar v : m_vars)
            varNames.add(v.getName());
        Map<String, Expr> subst = new HashMap<String, Expr>();
        for (int i = 0; i < m_conjuncts.size(); i++)
        {
            if (m_groups.get(i).getKind() != DiagramGroupKind.CONSTANT)
                continue;
            BinaryExpr eq = (BinaryExpr) m_conjuncts.get(i);
            if (eq.getRight().getKind() != ExprKind.ID)
                continue;
            String x = ((Id) eq.getRight()).getName();
            if (varNames.contains(x) && !subst.containsKey(x))
                subst.put(x, eq.getLeft());
        }
        if (subst.isEmpty())
            return;
        List<Expr> conjuncts = new ArrayList<Expr>();
        List<Group> groups = new ArrayList<Group>();
        for (int i = 0; i < m_conjuncts.size(); i++)
        {
            Expr c = Exprs.substitute(m_conjuncts.get(i), subst);
            if (c.getKind() == ExprKind.EQ && ((BinaryExpr) c).getLeft().equals(((BinaryExpr) c).getRight()))
                continue;
            conjuncts.add(c);
            groups.add(m_groups.get(i));
        }
        List<SortedVar> vars = new ArrayList<SortedVar>();
        for (SortedVar v : m_vars)
            if (!subst.containsKey(v.getName()))
                vars.add(v);
        m_vars = vars;
        m_conjuncts = conjuncts;
        m_groups = groups;
    }

    /**
     * The binder, including variables no active literal mentions until
     * {@link #pruneUnusedVars()} is called.
     **/
    public ImmutableList<SortedVar> getVars()
    {
        return ImmutableList.copyOf(m_vars);
    }

    /**
     * The number of literals ever added, active or not.
     **/
    public int capacity()
    {
        return m_conjuncts.size();
    }

    /**
     * The number of active literals.
     **/
    public int size()
    {
        return m_conjuncts.size() - m_removed.cardinality();
    }

    public Expr getConjunct(int i)
    {
        return m_conjuncts.get(i);
    }

    public Group getGroup(int i)
    {
        return m_groups.get(i);
    }

    public boolean isActive(int i)
    {
        return i < m_conjuncts.size() && !m_removed.get(i);
    }

    /**
     * Whether literal {@code i} is an unnegated relation atom.
     **/
    public boolean isPositive(int i)
    {
        return m_groups.get(i).getKind() == DiagramGroupKind.RELATION
                && m_conjuncts.get(i).getKind() != ExprKind.NOT;
    }

    /**
     * Indices of the active literals, in order.
     **/
    public List<Integer> activeIndices()
    {
        List<Integer> res = new ArrayList<Integer>();
        for (int i = 0; i < m_conjuncts.size(); i++)
            if (!m_removed.get(i))
                res.add(i);
        return res;
    }

    public List<Expr> activeConjuncts()
    {
        List<Expr> res = new ArrayList<Expr>();
        for (int i : activeIndices())
            res.add(m_conjuncts.get(i));
        return res;
    }

    /**
     * Active literal indices per group, groups in order of first occurrence.
     **/
    public Map<Group, List<Integer>> groups()
    {
        Map<Group, List<Integer>> res = new LinkedHashMap<Group, List<Integer>>();
        for (int i : activeIndices())
        {
            List<Integer> l = res.get(m_groups.get(i));
            if (l == null)
            {
                l = new ArrayList<Integer>();
                res.put(m_groups.get(i), l);
            }
            l.add(i);
        }
        return res;
    }

    public void remove(Collection<Integer> indices)
    {
        for (int i : indices)
            m_removed.set(i);
    }

    public void restore(Collection<Integer> indices)
    {
        for (int i : indices)
            m_removed.clear(i);
    }

    /**
     * Keeps only the literals with the given indices.
     **/
    public void retainOnly(Collection<Integer> indices)
    {
        for (int i : activeIndices())
            if (!indices.contains(i))
                m_removed.set(i);
    }

    /**
     * Drops variables that no active literal mentions.
     **/
    public void pruneUnusedVars()
    {
        m_vars = usedVars();
    }

    private List<SortedVar> usedVars()
    {
        Set<String> used = new LinkedHashSet<String>();
        for (Expr c : activeConjuncts())
            used.addAll(Exprs.freeIds(c));
        List<SortedVar> res = new ArrayList<SortedVar>();
        for (SortedVar v : m_vars)
            if (used.contains(v.getName()))
                res.add(v);
        return res;
    }

    /**
     * {@code exists vars. lit_1 & ... & lit_n} over the active literals.
     **/
    public Expr toExpr()
    {
        return Exprs.exists(usedVars(), Exprs.and(activeConjuncts()));
    }

    /**
     * The negation of {@link #toExpr()} as a clause:
     * {@code forall vars. !lit_1 | ... | !lit_n}; {@code false} when no
     * literal is active.
     **/
    public Expr toPredicate()
    {
        List<Expr> negated = new ArrayList<Expr>();
        for (Expr c : activeConjuncts())
            negated.add(Exprs.negate(c));
        return Exprs.forall(usedVars(), Exprs.or(negated));
    }

    @Override
    public String toString()
    {
        return toExpr().toString();
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    SolverSession.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Global;
import com.microsoft.z3.Log;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.UninterpretedSort;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.updr.enumerations.GeneralizationStrategy;

/**
 * One Z3 context and solver for a program. Owns the native vocabulary and
 * the translators built over it. Queries are made inside {@link Scope}s so
 * that no assertion outlives the query it belongs to.
 **/
public final class SolverSession implements AutoCloseable
{
    /**
     * The key of single-state queries.
     **/
    public static final String ONE = "one";
    /**
     * The pre-state key of one-step queries.
     **/
    public static final String OLD = "old";
    /**
     * The post-state key of one-step queries.
     **/
    public static final String NEW = "new";

    private static final Logger logger = LoggerFactory.getLogger(SolverSession.class);

    private final Program m_program;
    private final UpdrConfig m_config;
    private final Context m_ctx;
    private final Solver m_solver;
    private final QueryStats m_stats = new QueryStats();
    private final Map<Sort, UninterpretedSort> m_sorts = new HashMap<Sort, UninterpretedSort>();
    private final Map<String, FuncDecl<BoolSort>> m_relations = new HashMap<String, FuncDecl<BoolSort>>();
    private final Map<String, FuncDecl<UninterpretedSort>> m_terms = new HashMap<String, FuncDecl<UninterpretedSort>>();
    private final Map<List<String>, Translator> m_translators = new HashMap<List<String>, Translator>();
    private final Deque<Set<String>> m_axiomatizedKeys = new ArrayDeque<Set<String>>();
    private final boolean m_logOpened;
    private Predicate<String> m_undecided;
    private boolean m_closed;

    /**
     * Creates the context, applies the global Z3 settings of {@code config}
     * and asserts the program's axioms.
     **/
    public SolverSession(Program program, UpdrConfig config)
    {
        m_program = Preconditions.checkNotNull(program);
        m_config = Preconditions.checkNotNull(config);

        Global.setParameter("smt.random_seed", Integer.toString(config.getSeed()));
        Global.setParameter("memory_max_size", Integer.toString(config.getMemoryMaxMb()));
        Global.setParameter("smt.core.minimize",
                Boolean.toString(config.getGeneralization() == GeneralizationStrategy.UNSAT_CORE));

        boolean logOpened = false;
        if (config.getZ3Log() != null)
        {
            logOpened = Log.open(config.getZ3Log().toString());
            if (!logOpened)
                logger.warn("could not open Z3 interaction log {}", config.getZ3Log());
        }
        m_logOpened = logOpened;

        HashMap<String, String> cfg = new HashMap<String, String>();
        cfg.put("model", "true");
        m_ctx = new Context(cfg);
        m_solver = m_ctx.mkSolver();
        if (config.getTimeoutMs() > 0)
            applyTimeout(config.getTimeoutMs());

        m_axiomatizedKeys.push(new HashSet<String>());
        Translator t = getTranslator(ONE);
        for (Expr axiom : program.getAxioms())
            m_solver.add(t.translate(axiom, 0));
        logger.debug("solver session for program {} ready, {}", program.fingerprint(), config);
    }

    public Program getProgram()
    {
        return m_program;
    }

    public UpdrConfig getConfig()
    {
        return m_config;
    }

    public QueryStats getStats()
    {
        return m_stats;
    }

    Context getContext()
    {
        return m_ctx;
    }

    /**
     * The name of the key of state {@code i} in an n-step trace.
     **/
    public static String stateKey(int i)
    {
        return "state" + i;
    }

    /**
     * A solver scope. Closing it pops every assertion made since it was
     * opened.
     **/
    public final class Scope implements AutoCloseable
    {
        private final int m_level;
        private boolean m_open = true;

        private Scope(int level)
        {
            m_level = level;
        }

        @Override
        public void close()
        {
            if (!m_open)
                return;
            Preconditions.checkState(m_solver.getNumScopes() == m_level, "scopes closed out of order");
            m_open = false;
            pop();
        }
    }

    /**
     * Opens a new scope.
     **/
    public Scope newScope()
    {
        push();
        return new Scope(m_solver.getNumScopes());
    }

    private void push()
    {
        m_solver.push();
        m_axiomatizedKeys.push(new HashSet<String>());
    }

    private void pop()
    {
        m_solver.pop();
        m_axiomatizedKeys.pop();
    }

    /**
     * The translator over the given ordered keys. Derived-relation
     * definitions are asserted for every key not yet defined in the current
     * scope.
     **/
    public Translator getTranslator(String... keys)
    {
        List<String> k = ImmutableList.copyOf(keys);
        Translator t = cachedTranslator(k);
        List<RelationDecl> derived = m_program.getDerivedRelations();
        for (int i = 0; i < k.size(); i++)
        {
            if (isAxiomatized(k.get(i)))
                continue;
            for (RelationDecl r : derived)
                m_solver.add(t.translate(r.getDerivedAxiom(), i));
            m_axiomatizedKeys.peek().add(k.get(i));
        }
        return t;
    }

    /**
     * The translator over the keys {@code state0 .. state<n-1>}.
     **/
    public Translator getTraceTranslator(int n)
    {
        String[] keys = new String[n];
        for (int i = 0; i < n; i++)
            keys[i] = stateKey(i);
        return getTranslator(keys);
    }

    private Translator cachedTranslator(List<String> keys)
    {
        Translator t = m_translators.get(keys);
        if (t == null)
        {
            t = new Translator(this, keys);
            m_translators.put(keys, t);
        }
        return t;
    }

    private boolean isAxiomatized(String key)
    {
        for (Set<String> s : m_axiomatizedKeys)
            if (s.contains(key))
                return true;
        return false;
    }

    /**
     * Asserts formulas in the current scope.
     **/
    public void add(BoolExpr... constraints)
    {
        m_solver.add(constraints);
    }

    /**
     * Checks satisfiability under {@code assumptions}. A query that returns
     * {@code UNKNOWN} is retried with a longer timeout; without a timeout it
     * is not retried.
     *
     * @param description names the query in logs and errors
     * @return {@link Status#SATISFIABLE} or {@link Status#UNSATISFIABLE}
     * @throws InconclusiveQueryException if the query stays undecided
     **/
    public Status check(String description, BoolExpr... assumptions)
    {
        Stopwatch watch = Stopwatch.createStarted();
        int timeout = m_config.getTimeoutMs();
        int attempt = 0;
        try
        {
            while (true)
            {
                Status st;
                String reason = null;
                if (m_undecided != null && m_undecided.test(description))
                {
                    st = Status.UNKNOWN;
                    reason = "canceled";
                }
                else
                {
                    st = m_solver.check(assumptions);
                    if (st == Status.UNKNOWN)
                        reason = m_solver.getReasonUnknown();
                }
                if (st != Status.UNKNOWN)
                    return st;
                if (attempt >= m_config.getQueryRetries())
                    throw new InconclusiveQueryException(description, reason);
                if (timeout <= 0)
                {
                    logger.warn("query '{}' returned unknown ({}) without a timeout, not retrying", description,
                            reason);
                    throw new InconclusiveQueryException(description, reason);
                }
                attempt++;
                timeout = (int) Math.min(Integer.MAX_VALUE, Math.round(timeout * m_config.getQueryBackoff()));
                applyTimeout(timeout);
                logger.warn("query '{}' returned unknown ({}), retry {} of {} with timeout {} ms", description,
                        reason, attempt, m_config.getQueryRetries(), timeout);
            }
        }
        finally
        {
            if (timeout != m_config.getTimeoutMs())
                applyTimeout(m_config.getTimeoutMs());
            long nanos = watch.elapsed(TimeUnit.NANOSECONDS);
            m_stats.record(description, nanos);
            if (logger.isDebugEnabled())
                logger.debug("query '{}' took {} ms", description, TimeUnit.NANOSECONDS.toMillis(nanos));
        }
    }

    /**
     * Makes every query whose description {@code undecided} accepts return
     * {@code UNKNOWN} without reaching the solver; null restores normal
     * checking.
     **/
    void setUndecided(Predicate<String> undecided)
    {
        m_undecided = undecided;
    }

    private void applyTimeout(int timeoutMs)
    {
        Params p = m_ctx.mkParams();
        p.add("timeout", timeoutMs > 0 ? timeoutMs : Integer.MAX_VALUE);
        m_solver.setParameters(p);
    }

    /**
     * The model of the last satisfiable check.
     **/
    public Model getModel()
    {
        return m_solver.getModel();
    }

    /**
     * The subset of the assumptions of the last unsatisfiable check that
     * suffices for unsatisfiability.
     **/
    public BoolExpr[] getUnsatCore()
    {
        return m_solver.getUnsatCore();
    }

    /**
     * A model of the last satisfiable check whose universes are as small as
     * possible, sort by sort in declaration order. Without
     * {@code updr.minimize-models} this is {@link #getModel()}.
     **/
    public Model minimalModel(String description, BoolExpr... assumptions)
    {
        Model m = m_solver.getModel();
        if (!m_config.isMinimizeModels())
            return m;
        Translator t = cachedTranslator(ImmutableList.of(ONE));
        int pushed = 0;
        try
        {
            for (Sort s : m_program.getSorts())
            {
                UninterpretedSort z = sort(s);
                if (!Arrays.asList(m.getSorts()).contains(z))
                    continue;
                int size = m.getSortUniverse(z).length;
                for (int n = 1; n < size; n++)
                {
                    push();
                    pushed++;
                    m_solver.add(t.translate(Logic.cardinalityConstraint(s, n), 0));
                    if (check(description + " [|" + s + "| <= " + n + "]", assumptions) == Status.SATISFIABLE)
                    {
                        m = m_solver.getModel();
                        break;
                    }
                    pop();
                    pushed--;
                }
            }
            return m;
        }
        finally
        {
            for (; pushed > 0; pushed--)
                pop();
        }
    }

    /**
     * Fresh boolean constants used as assumption literals.
     **/
    public BoolExpr[] mkTrackers(int n)
    {
        BoolExpr[] res = new BoolExpr[n];
        for (int i = 0; i < n; i++)
            res[i] = m_ctx.mkBoolConst(m_config.getKeyPrefix() + "!track" + i);
        return res;
    }

    UninterpretedSort sort(Sort s)
    {
        Preconditions.checkArgument(!s.isBool(), "bool is not an uninterpreted sort");
        UninterpretedSort z = m_sorts.get(s);
        if (z == null)
        {
            z = m_ctx.mkUninterpretedSort(m_config.getKeyPrefix() + s.getName());
            m_sorts.put(s, z);
        }
        return z;
    }

    /**
     * Copies of mutable symbols are named {@code name!key}; program
     * identifiers never contain {@code '!'}, so these cannot meet an
     * immutable symbol's name.
     **/
    private String nativeName(String key, SymbolDecl d)
    {
        if (d.isMutable())
            return m_config.getKeyPrefix() + d.getName() + "!" + key;
        return m_config.getKeyPrefix() + d.getName();
    }

    private com.microsoft.z3.Sort[] domain(SymbolDecl d)
    {
        com.microsoft.z3.Sort[] res = new com.microsoft.z3.Sort[d.getArity()];
        for (int i = 0; i < res.length; i++)
            res[i] = sort(d.getDomain().get(i));
        return res;
    }

    FuncDecl<BoolSort> relation(String key, RelationDecl r)
    {
        String name = nativeName(key, r);
        FuncDecl<BoolSort> f = m_relations.get(name);
        if (f == null)
        {
            f = m_ctx.mkFuncDecl(name, domain(r), m_ctx.getBoolSort());
            m_relations.put(name, f);
        }
        return f;
    }

    FuncDecl<UninterpretedSort> term(String key, SymbolDecl d)
    {
        Preconditions.checkArgument(!d.getRange().isBool(), "%s is a relation", d);
        String name = nativeName(key, d);
        FuncDecl<UninterpretedSort> f = m_terms.get(name);
        if (f == null)
        {
            f = m_ctx.mkFuncDecl(name, domain(d), sort(d.getRange()));
            m_terms.put(name, f);
        }
        return f;
    }

    /**
     * Releases the native context.
     **/
    @Override
    public void close()
    {
        if (m_closed)
            return;
        m_closed = true;
        logger.debug("closing solver session: {}", m_stats);
        m_ctx.close();
        if (m_logOpened)
            Log.close();
    }
}

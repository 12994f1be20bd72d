/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Frames.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.updr.enumerations.CounterexampleKind;
import org.updr.enumerations.GeneralizationStrategy;
import org.updr.enumerations.PushFrameZero;
import org.updr.enumerations.TransitionOrder;

/**
 * The UPDR search loop over a {@link SearchState}: block states that
 * violate safety at the deepest frame, push predicates forward, and stop
 * when two adjacent frames coincide or a blocking chain reaches the initial
 * states.
 **/
public final class Frames
{
    private static final Logger logger = LoggerFactory.getLogger(Frames.class);

    private final SolverSession m_session;
    private final Program m_program;
    private final UpdrConfig m_config;
    private final SearchState m_state;
    private final Generalizer m_generalizer;
    private final Map<String, long[]> m_transitionTimes = new HashMap<String, long[]>();

    /**
     * Result of a predecessor query: either a predecessor state or the unsat
     * core that refuted all transitions.
     **/
    private static final class Predecessor
    {
        final Trace trace;
        final String transition;
        final Set<Integer> core;

        Predecessor(Trace trace, String transition, Set<Integer> core)
        {
            this.trace = trace;
            this.transition = transition;
            this.core = core;
        }
    }

    public Frames(SolverSession session, SearchState state)
    {
        Preconditions.checkArgument(state.getNumFrames() >= 2, "at least two frames are needed");
        m_session = session;
        m_program = session.getProgram();
        m_config = session.getConfig();
        m_state = state;
        if (m_config.getGeneralization() == GeneralizationStrategy.UNSAT_CORE)
            m_generalizer = new UnsatCoreGeneralizer();
        else
            m_generalizer = new BruteForceGeneralizer();
    }

    public SearchState getState()
    {
        return m_state;
    }

    /**
     * Runs until the safety property is proved or disproved, or until the
     * iteration limit is reached or the thread is interrupted. An
     * interrupted search can be resumed by calling this again, or from a
     * checkpoint of {@link #getState()}.
     **/
    public SearchResult search()
    {
        logger.info("searching from {} frames, {} pending obligations", m_state.getNumFrames(),
                m_state.getObligations().size());
        Deque<Obligation> obligations = m_state.getObligations();
        while (true)
        {
            if (isInterrupted())
            {
                logger.info("interrupted after {} iterations", m_state.getIterations());
                return SearchResult.interrupted();
            }
            m_state.incrementIterations();

            if (!obligations.isEmpty())
            {
                if (process(obligations))
                    return SearchResult.disproved(counterexample(obligations));
                continue;
            }

            int fixpoint = findFixpoint();
            if (fixpoint >= 0)
                return proved(fixpoint);

            int n = m_state.getNumFrames() - 1;
            if (m_state.getSafeUpTo() < n)
            {
                Trace bad = badState(n);
                if (bad != null)
                {
                    Obligation o = new Obligation(bad.asDiagram(0, m_config.isSimplifyDiagram()), n, null, true, false);
                    logger.debug("new obligation {}", o);
                    obligations.push(o);
                }
                else
                {
                    m_state.setSafeUpTo(n);
                    logger.info("frame {} is safe", n);
                }
                continue;
            }

            m_state.addFrame();
            logger.info("added frame {}", n + 1);
            push();
            if (m_config.isAssertInductiveTrace())
                assertInductiveTrace();
            if (logger.isDebugEnabled())
                logger.debug("frames after pushing:\n{}", m_state);
        }
    }

    private boolean isInterrupted()
    {
        if (Thread.currentThread().isInterrupted())
            return true;
        return m_config.getMaxIterations() > 0 && m_state.getIterations() >= m_config.getMaxIterations();
    }

    private int findFixpoint()
    {
        for (int i = 0; i + 1 < m_state.getNumFrames() && i <= m_state.getSafeUpTo(); i++)
            if (m_state.getFrame(i + 1).containsAll(m_state.getFrame(i)))
                return i;
        return -1;
    }

    private SearchResult proved(int frame)
    {
        List<Expr> invariant = new ArrayList<Expr>(m_program.getSafeties());
        for (Expr p : m_state.getFrame(frame).getPredicates())
            if (!invariant.contains(p))
                invariant.add(p);
        if (m_config.isRecheckInvariant())
        {
            Trace bad = Logic.checkInductive(m_session, invariant);
            if (bad != null)
                throw new InternalInvariantException("frame " + frame + " is not inductive:\n" + bad);
        }
        logger.info("frame {} is a fixpoint", frame);
        return SearchResult.proved(invariant, frame);
    }

    /**
     * Processes the top of {@code stack}: pushes a predecessor, or blocks
     * and pops it.
     *
     * @return whether the top obligation intersects the initial states
     **/
    private boolean process(Deque<Obligation> stack)
    {
        Obligation o = stack.peek();
        Diagram d = o.getDiagram();
        int j = o.getFrame();

        Set<Integer> initCore = initCore(d);
        if (initCore == null)
        {
            logger.debug("obligation {} intersects the initial states", o);
            return true;
        }
        Preconditions.checkState(j >= 1, "obligation at frame 0 is disjoint from frame 0");

        Predecessor p = findPredecessor(d, j - 1);
        if (p.trace != null)
        {
            Obligation pre = new Obligation(p.trace.asDiagram(0, m_config.isSimplifyDiagram()), j - 1,
                    p.transition, false, o.isMay());
            logger.debug("new obligation {}", pre);
            stack.push(pre);
            return false;
        }

        Set<Integer> core = new LinkedHashSet<Integer>(p.core);
        core.addAll(initCore);
        Expr predicate = m_generalizer.generalize(d.copy(), new BlockingContext(this, j, core));
        block(predicate, j);
        stack.pop();
        return false;
    }

    /**
     * The context in which {@code d} is blocked at {@code frame}, carrying
     * the unsat cores of the refutations; null if {@code d} intersects
     * frame 0 or has a predecessor in frame {@code frame - 1}.
     **/
    BlockingContext blockingContext(Diagram d, int frame)
    {
        Preconditions.checkArgument(frame >= 1, "nothing is blocked at frame 0");
        Set<Integer> initCore = initCore(d);
        if (initCore == null)
            return null;
        Predecessor p = findPredecessor(d, frame - 1);
        if (p.trace != null)
            return null;
        Set<Integer> core = new LinkedHashSet<Integer>(p.core);
        core.addAll(initCore);
        return new BlockingContext(this, frame, core);
    }

    private void block(Expr predicate, int frame)
    {
        for (int i = 0; i <= frame; i++)
            m_state.getFrame(i).add(predicate);
        m_state.recordPredicate(predicate);
        logger.info("[{}] {}", frame, predicate);
        if (m_config.isSmokeTest())
        {
            Trace bad = Logic.checkBounded(m_session, predicate, frame);
            if (bad != null)
                throw new InternalInvariantException("learned predicate " + predicate + " at frame " + frame
                        + " is violated by a reachable state:\n" + bad);
        }
        if (m_config.isAssertInductiveTrace())
            assertInductiveTrace();
    }

    private void push()
    {
        int first = m_config.getPushFrameZero() == PushFrameZero.ALWAYS ? 0 : 1;
        for (int i = first; i + 1 < m_state.getNumFrames(); i++)
        {
            Frame f = m_state.getFrame(i);
            Frame next = m_state.getFrame(i + 1);
            Map<Expr, Integer> cache = m_state.getPushCache(i);
            for (Expr p : f.getPredicates())
            {
                if (next.contains(p))
                    continue;
                Integer tried = cache.get(p);
                if (tried != null && tried == f.size())
                    continue;
                while (true)
                {
                    Trace cti = pushCounterexample(i, p);
                    if (cti == null)
                    {
                        next.add(p);
                        cache.remove(p);
                        logger.debug("pushed {} to frame {}", p, i + 1);
                        break;
                    }
                    if (m_config.isBlockMayCexs() && blockMay(cti, i))
                        continue;
                    cache.put(p, f.size());
                    break;
                }
            }
        }
    }

    private Trace pushCounterexample(int frame, Expr predicate)
    {
        List<Expr> hyps = m_state.getFrame(frame).getPredicates();
        for (TransitionDecl t : orderedTransitions())
        {
            Trace cti = Logic.checkTwoStateImplication(m_session, hyps, t, predicate);
            if (cti != null)
                return cti;
        }
        return null;
    }

    private boolean blockMay(Trace cti, int frame)
    {
        Deque<Obligation> stack = new ArrayDeque<Obligation>();
        stack.push(new Obligation(cti.asDiagram(0, m_config.isSimplifyDiagram()), frame,
                cti.getTransitions().get(0), false, true));
        while (!stack.isEmpty())
        {
            if (process(stack))
            {
                logger.debug("may-obligation chain of length {} reaches the initial states", stack.size());
                return false;
            }
        }
        return true;
    }

    private Trace badState(int frame)
    {
        try (SolverSession.Scope scope = m_session.newScope())
        {
            Translator t = m_session.getTranslator(SolverSession.ONE);
            assertFrame(t, frame, 0);
            m_session.add(t.translate(Exprs.not(m_program.getSafety()), 0));
            String description = "safety of frame " + frame;
            if (m_session.check(description) == Status.SATISFIABLE)
                return Trace.fromZ3(t, m_session.minimalModel(description));
            return null;
        }
    }

    private void assertFrame(Translator t, int frame, int index)
    {
        for (Expr p : m_state.getFrame(frame).getPredicates())
            m_session.add(t.translate(p, index));
    }

    /**
     * The indices of the literals of {@code d} needed to show it disjoint
     * from frame 0, or null if it intersects frame 0.
     **/
    Set<Integer> initCore(Diagram d)
    {
        try (SolverSession.Scope scope = m_session.newScope())
        {
            Translator t = m_session.getTranslator(SolverSession.ONE);
            assertFrame(t, 0, 0);
            List<Integer> indices = d.activeIndices();
            BoolExpr[] trackers = m_session.mkTrackers(indices.size());
            m_session.add(t.translateTracked(d.getVars(), d.activeConjuncts(), 0, trackers));
            if (m_session.check("initial-state intersection of " + d, trackers) == Status.SATISFIABLE)
                return null;
            return coreIndices(indices, trackers, m_session.getUnsatCore());
        }
    }

    boolean intersectsInit(Diagram d)
    {
        try (SolverSession.Scope scope = m_session.newScope())
        {
            Translator t = m_session.getTranslator(SolverSession.ONE);
            assertFrame(t, 0, 0);
            m_session.add(t.translate(d.toExpr(), 0));
            return m_session.check("initial-state intersection") == Status.SATISFIABLE;
        }
    }

    boolean hasPredecessor(Diagram d, int frame)
    {
        try (SolverSession.Scope scope = m_session.newScope())
        {
            Translator t = m_session.getTranslator(SolverSession.OLD, SolverSession.NEW);
            assertFrame(t, frame, 0);
            m_session.add(t.translateTransitions(1));
            m_session.add(t.translate(d.toExpr(), 1));
            return m_session.check("predecessor in frame " + frame) == Status.SATISFIABLE;
        }
    }

    private Predecessor findPredecessor(Diagram d, int frame)
    {
        try (SolverSession.Scope scope = m_session.newScope())
        {
            Translator t = m_session.getTranslator(SolverSession.OLD, SolverSession.NEW);
            assertFrame(t, frame, 0);
            List<Integer> indices = d.activeIndices();
            BoolExpr[] trackers = m_session.mkTrackers(indices.size());
            m_session.add(t.translateTracked(d.getVars(), d.activeConjuncts(), 1, trackers));

            Set<Integer> core = new LinkedHashSet<Integer>();
            for (TransitionDecl tr : orderedTransitions())
            {
                try (SolverSession.Scope inner = m_session.newScope())
                {
                    m_session.add(t.translateTransition(tr, 1));
                    String description = "predecessor in frame " + frame + " via " + tr.getName() + " of " + d;
                    if (!core.isEmpty()
                            && m_session.check(description + " (core)", trackers(indices, trackers, core))
                                    == Status.UNSATISFIABLE)
                        continue;
                    Stopwatch watch = Stopwatch.createStarted();
                    Status st = m_session.check(description, trackers);
                    recordTime(tr, watch.elapsed(TimeUnit.NANOSECONDS));
                    if (st == Status.SATISFIABLE)
                    {
                        Trace pre = Trace.fromZ3(t, m_session.minimalModel(description, trackers))
                                .withTransitions(Collections.singletonList(tr.getName()));
                        return new Predecessor(pre, tr.getName(), null);
                    }
                    core.addAll(coreIndices(indices, trackers, m_session.getUnsatCore()));
                }
            }
            return new Predecessor(null, null, core);
        }
    }

    private static Set<Integer> coreIndices(List<Integer> indices, BoolExpr[] trackers, BoolExpr[] core)
    {
        Map<String, Integer> byName = new HashMap<String, Integer>();
        for (int k = 0; k < trackers.length; k++)
            byName.put(trackers[k].toString(), indices.get(k));
        Set<Integer> res = new LinkedHashSet<Integer>();
        for (BoolExpr c : core)
        {
            Integer i = byName.get(c.toString());
            Preconditions.checkState(i != null, "unsat core contains %s", c);
            res.add(i);
        }
        return res;
    }

    private static BoolExpr[] trackers(List<Integer> indices, BoolExpr[] trackers, Set<Integer> selected)
    {
        List<BoolExpr> res = new ArrayList<BoolExpr>();
        for (int k = 0; k < trackers.length; k++)
            if (selected.contains(indices.get(k)))
                res.add(trackers[k]);
        return res.toArray(new BoolExpr[res.size()]);
    }

    private void recordTime(TransitionDecl t, long nanos)
    {
        long[] times = m_transitionTimes.get(t.getName());
        if (times == null)
        {
            times = new long[2];
            m_transitionTimes.put(t.getName(), times);
        }
        times[0]++;
        times[1] += nanos;
    }

    private long averageTime(TransitionDecl t)
    {
        long[] times = m_transitionTimes.get(t.getName());
        return times == null ? 0 : times[1] / times[0];
    }

    private List<TransitionDecl> orderedTransitions()
    {
        List<TransitionDecl> res = new ArrayList<TransitionDecl>(m_program.getTransitions());
        if (m_config.getTransitionOrder() == TransitionOrder.FASTEST_FIRST)
        {
            Collections.sort(res, new Comparator<TransitionDecl>()
            {
                @Override
                public int compare(TransitionDecl a, TransitionDecl b)
                {
                    return Long.compare(averageTime(a), averageTime(b));
                }
            });
        }
        return res;
    }

    private Counterexample counterexample(Deque<Obligation> stack)
    {
        List<Obligation> chain = new ArrayList<Obligation>(stack);
        List<Expr> diagrams = new ArrayList<Expr>();
        List<String> transitions = new ArrayList<String>();
        for (int i = 0; i < chain.size(); i++)
        {
            diagrams.add(chain.get(i).getDiagram().toExpr());
            if (i + 1 < chain.size())
                transitions.add(chain.get(i).getTransition());
        }
        logger.info("counterexample chain of length {} reaches the initial states", chain.size() - 1);
        if (m_config.isConcretizeCounterexamples())
        {
            Trace trace = concretize(chain, transitions, true);
            if (trace == null)
                trace = concretize(chain, transitions, false);
            if (trace != null)
                return Counterexample.concrete(CounterexampleKind.TRACE, trace, diagrams);
            logger.info("no concrete trace follows the chain; reporting it abstractly");
        }
        return Counterexample.abstractTrace(diagrams, transitions);
    }

    private Trace concretize(List<Obligation> chain, List<String> transitions, boolean withDiagrams)
    {
        int k = chain.size() - 1;
        try (SolverSession.Scope scope = m_session.newScope())
        {
            Translator t = m_session.getTraceTranslator(k + 1);
            for (Expr init : m_program.getInits())
                m_session.add(t.translate(init, 0));
            for (int step = 1; step <= k; step++)
                m_session.add(t.translateTransition(m_program.getTransition(transitions.get(step - 1)), step));
            if (withDiagrams)
                for (int step = 0; step <= k; step++)
                    m_session.add(t.translate(chain.get(step).getDiagram().toExpr(), step));
            m_session.add(t.translate(Exprs.not(m_program.getSafety()), k));
            String description = "concrete trace of length " + k + (withDiagrams ? " through the chain" : "");
            if (m_session.check(description) == Status.SATISFIABLE)
                return Trace.fromZ3(t, m_session.minimalModel(description)).withTransitions(transitions);
            return null;
        }
    }

    private void assertInductiveTrace()
    {
        Trace bad = Logic.checkImplication(m_session, m_program.getInits(), m_state.getFrame(0).getPredicates());
        if (bad != null)
            throw new InternalInvariantException("initial states violate frame 0:\n" + bad);
        for (int i = 0; i + 1 < m_state.getNumFrames(); i++)
        {
            List<Expr> hyps = m_state.getFrame(i).getPredicates();
            for (Expr p : m_state.getFrame(i + 1).getPredicates())
                for (TransitionDecl t : m_program.getTransitions())
                {
                    Trace cti = Logic.checkTwoStateImplication(m_session, hyps, t, p);
                    if (cti != null)
                        throw new InternalInvariantException("frame " + i + " does not imply " + p
                                + " after " + t.getName() + ":\n" + cti);
                }
        }
    }
}

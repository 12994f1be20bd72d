/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Logic.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.microsoft.z3.Status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validity checks over a {@link SolverSession}. Each check returns null
 * when the property holds and otherwise a {@link Trace} refuting it.
 **/
public final class Logic
{
    private static final Logger logger = LoggerFactory.getLogger(Logic.class);

    private Logic()
    {
    }

    /**
     * {@code exists X1..Xn. forall Y. Y = X1 | ... | Y = Xn}: the universe of
     * {@code sort} has at most {@code n} elements.
     **/
    public static Expr cardinalityConstraint(Sort sort, int n)
    {
        Preconditions.checkArgument(n >= 1, "cardinality bound must be positive");
        List<SortedVar> xs = new ArrayList<SortedVar>();
        List<Expr> eqs = new ArrayList<Expr>();
        SortedVar y = new SortedVar("Y__card", sort);
        for (int i = 0; i < n; i++)
        {
            SortedVar x = new SortedVar("X" + i + "__card", sort);
            xs.add(x);
            eqs.add(Exprs.eq(Exprs.id(y.getName()), Exprs.id(x.getName())));
        }
        return Exprs.exists(xs, Exprs.forall(y, Exprs.or(eqs)));
    }

    /**
     * Whether the conjunction of {@code hyps} implies each of {@code concs}
     * in every single state.
     *
     * @return a state satisfying the hypotheses and violating the first
     *         conclusion that does not follow, or null
     **/
    public static Trace checkImplication(SolverSession s, List<Expr> hyps, List<Expr> concs)
    {
        try (SolverSession.Scope scope = s.newScope())
        {
            Translator t = s.getTranslator(SolverSession.ONE);
            for (Expr h : hyps)
                s.add(t.translate(h, 0));
            for (Expr c : concs)
            {
                try (SolverSession.Scope inner = s.newScope())
                {
                    s.add(t.translate(Exprs.not(c), 0));
                    if (s.check("implication of " + c) == Status.SATISFIABLE)
                        return Trace.fromZ3(t, s.minimalModel("implication of " + c));
                }
            }
            return null;
        }
    }

    /**
     * Whether {@code hyps} in a state and one step of {@code transition}
     * imply {@code conc} in the next state.
     *
     * @return a two-state trace refuting the implication, or null
     **/
    public static Trace checkTwoStateImplication(SolverSession s, List<Expr> hyps, TransitionDecl transition,
            Expr conc)
    {
        try (SolverSession.Scope scope = s.newScope())
        {
            Translator t = s.getTranslator(SolverSession.OLD, SolverSession.NEW);
            for (Expr h : hyps)
                s.add(t.translate(h, 0));
            s.add(t.translateTransition(transition, 1));
            s.add(t.translate(Exprs.not(conc), 1));
            String description = "preservation of " + conc + " by " + transition.getName();
            if (s.check(description) == Status.SATISFIABLE)
                return Trace.fromZ3(t, s.minimalModel(description))
                        .withTransitions(Collections.singletonList(transition.getName()));
            return null;
        }
    }

    /**
     * Whether every initial state satisfies {@code invariants}.
     **/
    public static Trace checkInitiation(SolverSession s, List<Expr> invariants)
    {
        return checkImplication(s, s.getProgram().getInits(), invariants);
    }

    /**
     * Whether {@code invariants} hold initially and are preserved, together,
     * by every transition.
     *
     * @return the first failure found: a one-state trace if initiation fails,
     *         a two-state trace if consecution fails; or null
     **/
    public static Trace checkInductive(SolverSession s, List<Expr> invariants)
    {
        Trace init = checkInitiation(s, invariants);
        if (init != null)
            return init;
        for (Expr inv : invariants)
            for (TransitionDecl t : s.getProgram().getTransitions())
            {
                Trace cti = checkTwoStateImplication(s, invariants, t, inv);
                if (cti != null)
                {
                    logger.debug("{} is not preserved by {}", inv, t.getName());
                    return cti;
                }
            }
        return null;
    }

    /**
     * Whether {@code property} holds in every state reachable in at most
     * {@code depth} steps.
     *
     * @return a trace from an initial state to a violation, or null
     **/
    public static Trace checkBounded(SolverSession s, Expr property, int depth)
    {
        Preconditions.checkArgument(depth >= 0, "negative depth");
        for (int k = 0; k <= depth; k++)
        {
            try (SolverSession.Scope scope = s.newScope())
            {
                Translator t = s.getTraceTranslator(k + 1);
                for (Expr i : s.getProgram().getInits())
                    s.add(t.translate(i, 0));
                for (int step = 1; step <= k; step++)
                    s.add(t.translateTransitions(step));
                s.add(t.translate(Exprs.not(property), k));
                String description = "bounded check of " + property + " at depth " + k;
                if (s.check(description) == Status.SATISFIABLE)
                    return identifyTransitions(Trace.fromZ3(t, s.minimalModel(description)));
            }
        }
        return null;
    }

    /**
     * Labels every step of {@code trace} with the first transition, in
     * declaration order, that explains it.
     **/
    static Trace identifyTransitions(Trace trace)
    {
        Program program = trace.getProgram();
        List<String> names = new ArrayList<String>();
        for (int step = 1; step < trace.getNumStates(); step++)
        {
            String found = null;
            for (TransitionDecl t : program.getTransitions())
            {
                if (takes(trace, t, step))
                {
                    found = t.getName();
                    break;
                }
            }
            names.add(found);
        }
        return trace.withTransitions(names);
    }

    private static boolean takes(Trace trace, TransitionDecl t, int step)
    {
        for (SymbolDecl d : trace.getProgram().getSymbols())
            if (d.isMutable() && !d.isDerived() && !t.modifies(d) && !trace.isUnchanged(d, step))
                return false;
        return trace.eval(Exprs.exists(t.getParams(), t.getBody()), step);
    }
}

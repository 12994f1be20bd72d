/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Updr.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.updr.enumerations.CounterexampleKind;
import org.updr.enumerations.ResultKind;

/**
 * Entry points: {@link #run} infers an inductive invariant for the safety
 * property; {@link #verify} checks that the declared invariants are
 * inductive as stated.
 **/
public final class Updr
{
    private static final Logger logger = LoggerFactory.getLogger(Updr.class);

    private Updr()
    {
    }

    /**
     * Searches for an inductive strengthening of the program's safety
     * property, starting from {@code updr.checkpoint.in} when set.
     *
     * @throws InconclusiveQueryException if a query stayed undecided; the
     *         search state is checkpointed first when
     *         {@code updr.checkpoint.out} is set
     * @throws CheckpointException if a checkpoint cannot be read or written
     **/
    public static SearchResult run(Program program, UpdrConfig config)
    {
        try (SolverSession session = new SolverSession(program, config))
        {
            return run(session);
        }
    }

    /**
     * {@link #run(Program, UpdrConfig)} over an open session; the caller
     * closes it.
     **/
    static SearchResult run(SolverSession session)
    {
        Program program = session.getProgram();
        UpdrConfig config = session.getConfig();
        Trace init = Logic.checkInitiation(session, program.getSafeties());
        if (init != null)
        {
            Counterexample cex = Counterexample.concrete(CounterexampleKind.INIT, init,
                    Collections.<Expr>emptyList());
            logger.info("an initial state violates safety:\n{}", init);
            writeCounterexample(config, cex);
            return SearchResult.disproved(cex);
        }

        SearchState state;
        if (config.getCheckpointIn() != null)
            state = Checkpoint.loadFrom(config.getCheckpointIn(), program);
        else
            state = SearchState.initial(program);
        Frames frames = new Frames(session, state);

        SearchResult result;
        try
        {
            result = frames.search();
        }
        catch (InconclusiveQueryException e)
        {
            logger.error("stopping on an inconclusive query: {}", e.getQuery());
            writeCheckpoint(config, state, program);
            throw e;
        }

        logger.info("discovered {} states ({} predicates without duplicates), {}", state.getStateCount(),
                state.getPredicates().size(), session.getStats());
        if (result.getKind() == ResultKind.PROVED)
            logger.info("proved safety with invariant\n  {}", Joiner.on("\n  ").join(result.getInvariant()));
        else
        {
            writeCheckpoint(config, state, program);
            if (result.getKind() == ResultKind.DISPROVED)
            {
                logger.info("safety violated:\n{}", result.getCounterexample());
                writeCounterexample(config, result.getCounterexample());
            }
        }
        return result;
    }

    /**
     * Checks that all declared invariants together hold initially and are
     * preserved by every transition.
     **/
    public static SearchResult verify(Program program, UpdrConfig config)
    {
        List<Expr> invariants = new ArrayList<Expr>();
        for (InvariantDecl inv : program.getInvariants())
            invariants.add(inv.getExpr());
        try (SolverSession session = new SolverSession(program, config))
        {
            Trace failure = Logic.checkInductive(session, invariants);
            Counterexample cex = null;
            if (failure != null)
            {
                CounterexampleKind kind = failure.getNumStates() == 1 ? CounterexampleKind.INIT : CounterexampleKind.CTI;
                cex = Counterexample.concrete(kind, failure, Collections.<Expr>emptyList());
            }
            if (cex == null)
            {
                logger.info("all {} invariants are inductive ({})", invariants.size(), session.getStats());
                return SearchResult.proved(invariants, -1);
            }
            logger.info("invariants are not inductive:\n{}", cex);
            writeCounterexample(config, cex);
            return SearchResult.disproved(cex);
        }
    }

    private static void writeCheckpoint(UpdrConfig config, SearchState state, Program program)
    {
        if (config.getCheckpointOut() != null)
            Checkpoint.saveTo(config.getCheckpointOut(), state, program);
    }

    private static void writeCounterexample(UpdrConfig config, Counterexample cex)
    {
        Path out = config.getCounterexampleJson();
        if (out == null)
            return;
        try
        {
            Files.write(out, TraceJson.toJson(cex).toString(1).getBytes(StandardCharsets.UTF_8));
            logger.info("counterexample written to {}", out);
        }
        catch (IOException e)
        {
            throw new UpdrException("cannot write counterexample " + out, e);
        }
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Checkpoint.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves and restores a {@link SearchState} as versioned JSON, keyed by the
 * fingerprint of the program it belongs to.
 **/
public final class Checkpoint
{
    public static final String FORMAT = "updr-checkpoint";
    public static final int VERSION = 1;

    private static final Logger logger = LoggerFactory.getLogger(Checkpoint.class);

    private Checkpoint()
    {
    }

    public static byte[] save(SearchState state, Program program)
    {
        JSONObject o = new JSONObject();
        o.put("format", FORMAT);
        o.put("version", VERSION);
        o.put("program", program.fingerprint());

        JSONArray frames = new JSONArray();
        JSONArray pushCache = new JSONArray();
        for (int i = 0; i < state.getNumFrames(); i++)
        {
            frames.put(ExprJson.encodeAll(state.getFrame(i).getPredicates()));
            JSONArray cache = new JSONArray();
            for (Map.Entry<Expr, Integer> e : state.getPushCache(i).entrySet())
                cache.put(new JSONObject().put("predicate", ExprJson.encode(e.getKey())).put("frameSize", e.getValue()));
            pushCache.put(cache);
        }
        o.put("frames", frames);
        o.put("pushCache", pushCache);
        o.put("predicates", ExprJson.encodeAll(state.getPredicates()));
        o.put("stateCount", state.getStateCount());
        o.put("iterations", state.getIterations());
        o.put("safeUpTo", state.getSafeUpTo());

        JSONArray obligations = new JSONArray();
        for (Obligation ob : state.getObligations())
        {
            Diagram d = ob.getDiagram();
            JSONObject diagram = new JSONObject().put("vars", ExprJson.encodeVars(d.getVars())).put("conjuncts",
                    ExprJson.encodeAll(d.activeConjuncts()));
            obligations.put(new JSONObject().put("frame", ob.getFrame())
                    .put("transition", ob.getTransition() == null ? JSONObject.NULL : ob.getTransition())
                    .put("safetyGoal", ob.isSafetyGoal()).put("diagram", diagram));
        }
        o.put("obligations", obligations);
        return o.toString(1).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Restores a search state saved for {@code program}.
     *
     * @throws CheckpointException if the data is malformed, of another
     *         format or version, saved for another program, or contains
     *         formulas that do not sort-check
     **/
    public static SearchState load(byte[] bytes, Program program)
    {
        try
        {
            JSONObject o = new JSONObject(new String(bytes, StandardCharsets.UTF_8));
            if (!FORMAT.equals(o.optString("format")))
                throw new CheckpointException("not a checkpoint: format is '" + o.optString("format") + "'");
            int version = o.getInt("version");
            if (version != VERSION)
                throw new CheckpointException("unsupported checkpoint version " + version);
            if (!program.fingerprint().equals(o.getString("program")))
                throw new CheckpointException("checkpoint belongs to another program");

            SearchState state = new SearchState();
            JSONArray frames = o.getJSONArray("frames");
            JSONArray pushCache = o.getJSONArray("pushCache");
            if (frames.length() < 2 || pushCache.length() != frames.length())
                throw new CheckpointException("checkpoint has " + frames.length() + " frames and "
                        + pushCache.length() + " push caches");
            for (int i = 0; i < frames.length(); i++)
            {
                Frame f = state.addFrame();
                for (Expr p : decodeChecked(frames.getJSONArray(i), program, "frame " + i))
                    f.add(p);
                JSONArray cache = pushCache.getJSONArray(i);
                for (int k = 0; k < cache.length(); k++)
                {
                    JSONObject entry = cache.getJSONObject(k);
                    Expr p = ExprJson.decode(entry.getJSONObject("predicate"), program);
                    program.checkFormula(p, "push cache of frame " + i);
                    state.getPushCache(i).put(p, entry.getInt("frameSize"));
                }
            }
            for (Expr p : decodeChecked(o.getJSONArray("predicates"), program, "predicate log"))
                state.restorePredicate(p);
            state.restoreCounters(o.getInt("stateCount"), o.getInt("iterations"), o.getInt("safeUpTo"));

            JSONArray obligations = o.getJSONArray("obligations");
            for (int i = 0; i < obligations.length(); i++)
                state.getObligations().addLast(obligation(obligations.getJSONObject(i), program, state));
            logger.info("restored {} frames, {} predicates and {} obligations from checkpoint",
                    state.getNumFrames(), state.getPredicates().size(), state.getObligations().size());
            return state;
        }
        catch (JSONException e)
        {
            throw new CheckpointException("malformed checkpoint: " + e.getMessage(), e);
        }
        catch (ProgramException e)
        {
            throw new CheckpointException("checkpoint does not match the program: " + e.getMessage(), e);
        }
        catch (IllegalArgumentException e)
        {
            throw new CheckpointException("inconsistent checkpoint: " + e.getMessage(), e);
        }
    }

    private static List<Expr> decodeChecked(JSONArray a, Program program, String context)
    {
        List<Expr> res = ExprJson.decodeAll(a, program);
        for (Expr e : res)
            program.checkFormula(e, context);
        return res;
    }

    private static Obligation obligation(JSONObject o, Program program, SearchState state)
    {
        int frame = o.getInt("frame");
        if (frame < 0 || frame >= state.getNumFrames())
            throw new CheckpointException("obligation at missing frame " + frame);
        String transition = o.isNull("transition") ? null : o.getString("transition");
        if (transition != null && program.getTransition(transition) == null)
            throw new CheckpointException("obligation refers to unknown transition " + transition);
        JSONObject d = o.getJSONObject("diagram");
        Diagram diagram = new Diagram(program, ExprJson.decodeVars(d.getJSONArray("vars"), program),
                ExprJson.decodeAll(d.getJSONArray("conjuncts"), program));
        program.checkFormula(diagram.toExpr(), "obligation at frame " + frame);
        return new Obligation(diagram, frame, transition, o.getBoolean("safetyGoal"), false);
    }

    public static void saveTo(Path path, SearchState state, Program program)
    {
        try
        {
            Files.write(path, save(state, program));
            logger.info("checkpoint written to {}", path);
        }
        catch (IOException e)
        {
            throw new CheckpointException("cannot write checkpoint " + path, e);
        }
    }

    public static SearchState loadFrom(Path path, Program program)
    {
        byte[] bytes;
        try
        {
            bytes = Files.readAllBytes(path);
        }
        catch (IOException e)
        {
            throw new CheckpointException("cannot read checkpoint " + path, e);
        }
        return load(bytes, program);
    }
}

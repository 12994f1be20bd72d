/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    TraceJson.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * The machine-readable form of counterexamples:
 * <pre>
 * { "type": "init" | "cti" | "trace", "abstract": b,
 *   "universes": [{"sort": s, "elements": [..]}],
 *   "immutable": {"relations": [..], "constants": [..], "functions": [..]},
 *   "mutable": [ one object of the same shape per state ],
 *   "transitions": [..], "diagrams": [..] }
 * </pre>
 **/
public final class TraceJson
{
    private TraceJson()
    {
    }

    public static JSONObject toJson(Counterexample cex)
    {
        JSONObject o = new JSONObject();
        o.put("type", cex.getKind().getName());
        o.put("abstract", cex.isAbstract());
        JSONArray universes = new JSONArray();
        JSONArray mutable = new JSONArray();
        JSONObject immutable = interpretation(new Trace.Interpretation());
        Trace t = cex.getTrace();
        if (t != null)
        {
            for (Map.Entry<Sort, ? extends List<String>> u : t.getUniverses().entrySet())
                universes.put(new JSONObject().put("sort", u.getKey().getName()).put("elements",
                        new JSONArray(u.getValue())));
            immutable = interpretation(t.getImmutable());
            for (int i = 0; i < t.getNumStates(); i++)
                mutable.put(interpretation(t.getState(i)));
        }
        o.put("universes", universes);
        o.put("immutable", immutable);
        o.put("mutable", mutable);
        o.put("transitions", new JSONArray(cex.getTransitions()));
        JSONArray diagrams = new JSONArray();
        for (Expr d : cex.getDiagrams())
            diagrams.put(d.toString());
        o.put("diagrams", diagrams);
        return o;
    }

    private static JSONObject interpretation(Trace.Interpretation interp)
    {
        JSONArray relations = new JSONArray();
        for (Map.Entry<String, Set<List<String>>> r : interp.relations.entrySet())
        {
            JSONArray tuples = new JSONArray();
            for (List<String> tuple : r.getValue())
                tuples.put(new JSONArray(tuple));
            relations.put(new JSONObject().put("name", r.getKey()).put("interpretation", tuples));
        }
        JSONArray constants = new JSONArray();
        for (Map.Entry<String, String> c : interp.constants.entrySet())
            constants.put(new JSONObject().put("name", c.getKey()).put("interpretation", c.getValue()));
        JSONArray functions = new JSONArray();
        for (Map.Entry<String, Map<List<String>, String>> f : interp.functions.entrySet())
        {
            JSONArray rows = new JSONArray();
            for (Map.Entry<List<String>, String> row : f.getValue().entrySet())
                rows.put(new JSONArray(row.getKey()).put(row.getValue()));
            functions.put(new JSONObject().put("name", f.getKey()).put("interpretation", rows));
        }
        return new JSONObject().put("relations", relations).put("constants", constants).put("functions", functions);
    }
}

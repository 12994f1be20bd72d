/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    ExprJson.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import org.updr.enumerations.ExprKind;

/**
 * Encodes expressions as tagged JSON trees, e.g.
 * {@code {"kind": "not", "arg": {"kind": "app", "callee": "holds", "args": [...]}}}.
 **/
public final class ExprJson
{
    private ExprJson()
    {
    }

    private static String tag(ExprKind kind)
    {
        return kind == ExprKind.BOOL_LITERAL ? "bool" : kind.name().toLowerCase(Locale.ROOT);
    }

    private static ExprKind kind(String tag)
    {
        if (tag.equals("bool"))
            return ExprKind.BOOL_LITERAL;
        try
        {
            ExprKind k = ExprKind.valueOf(tag.toUpperCase(Locale.ROOT));
            if (k != ExprKind.BOOL_LITERAL)
                return k;
        }
        catch (IllegalArgumentException e)
        {
            throw new JSONException("unknown expression kind " + tag, e);
        }
        throw new JSONException("unknown expression kind " + tag);
    }

    public static JSONObject encode(Expr e)
    {
        JSONObject o = new JSONObject().put("kind", tag(e.getKind()));
        switch (e.getKind())
        {
        case BOOL_LITERAL:
            return o.put("value", ((BoolLit) e).getValue());
        case ID:
            return o.put("name", ((Id) e).getName());
        case APP:
            return o.put("callee", ((AppExpr) e).getCallee()).put("args", encodeAll(((AppExpr) e).getArgs()));
        case NOT:
        case OLD:
            return o.put("arg", encode(((UnaryExpr) e).getArg()));
        case AND:
        case OR:
            return o.put("args", encodeAll(((NaryExpr) e).getArgs()));
        case IMPLIES:
        case IFF:
        case EQ:
        case NEQ:
            return o.put("left", encode(((BinaryExpr) e).getLeft())).put("right", encode(((BinaryExpr) e).getRight()));
        case ITE:
        {
            IteExpr i = (IteExpr) e;
            return o.put("cond", encode(i.getCond())).put("then", encode(i.getThen())).put("else",
                    encode(i.getElse()));
        }
        case FORALL:
        case EXISTS:
        {
            QuantifierExpr q = (QuantifierExpr) e;
            return o.put("vars", encodeVars(q.getVars())).put("body", encode(q.getBody()));
        }
        default:
            throw new IllegalStateException("unexpected kind " + e.getKind());
        }
    }

    public static JSONArray encodeAll(List<Expr> es)
    {
        JSONArray a = new JSONArray();
        for (Expr e : es)
            a.put(encode(e));
        return a;
    }

    public static JSONArray encodeVars(List<SortedVar> vars)
    {
        JSONArray a = new JSONArray();
        for (SortedVar v : vars)
            a.put(new JSONObject().put("name", v.getName()).put("sort", v.getSort().getName()));
        return a;
    }

    /**
     * Decodes an expression, resolving sort names against {@code program}.
     * The result is not sort-checked.
     *
     * @throws JSONException if {@code o} is not an encoded expression
     **/
    public static Expr decode(JSONObject o, Program program)
    {
        ExprKind k = kind(o.getString("kind"));
        switch (k)
        {
        case BOOL_LITERAL:
            return Exprs.bool(o.getBoolean("value"));
        case ID:
            return new Id(o.getString("name"));
        case APP:
            return new AppExpr(o.getString("callee"), decodeAll(o.getJSONArray("args"), program));
        case NOT:
        case OLD:
            return new UnaryExpr(k, decode(o.getJSONObject("arg"), program));
        case AND:
        case OR:
            return new NaryExpr(k, decodeAll(o.getJSONArray("args"), program));
        case IMPLIES:
        case IFF:
        case EQ:
        case NEQ:
            return new BinaryExpr(k, decode(o.getJSONObject("left"), program), decode(o.getJSONObject("right"), program));
        case ITE:
            return new IteExpr(decode(o.getJSONObject("cond"), program), decode(o.getJSONObject("then"), program),
                    decode(o.getJSONObject("else"), program));
        default:
            return new QuantifierExpr(k, decodeVars(o.getJSONArray("vars"), program),
                    decode(o.getJSONObject("body"), program));
        }
    }

    public static List<Expr> decodeAll(JSONArray a, Program program)
    {
        List<Expr> res = new ArrayList<Expr>(a.length());
        for (int i = 0; i < a.length(); i++)
            res.add(decode(a.getJSONObject(i), program));
        return res;
    }

    public static List<SortedVar> decodeVars(JSONArray a, Program program)
    {
        List<SortedVar> res = new ArrayList<SortedVar>(a.length());
        for (int i = 0; i < a.length(); i++)
        {
            JSONObject v = a.getJSONObject(i);
            String sortName = v.getString("sort");
            Sort s = program.getSort(sortName);
            if (s == null)
                throw new JSONException("unknown sort " + sortName);
            res.add(new SortedVar(v.getString("name"), s));
        }
        return res;
    }
}

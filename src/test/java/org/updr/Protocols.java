/*++
 Copyright (c) 2012 Microsoft Corporation

Module Name:

    Protocols.java

Abstract:

    Small transition systems shared by the tests: a lock service, the
    same service without the acquire guard, and a token passed along a
    fixed successor function.

--*/

package org.updr;

import static org.updr.Exprs.*;

import java.util.Arrays;
import java.util.Collections;

final class Protocols
{
    private Protocols()
    {
    }

    /**
     * One lock, any number of nodes. {@code locked} is derived from
     * {@code unlocked}.
     **/
    static Program lock()
    {
        return lock(true, true);
    }

    /**
     * The lock service where {@code acquire} does not check that the lock
     * is free; two nodes can hold it after two steps.
     **/
    static Program unguardedLock()
    {
        return lock(false, true);
    }

    /**
     * The unguarded lock with an unused immutable node constant.
     **/
    static Program unguardedLock(String constant)
    {
        return lock(false, true, constant);
    }

    static Program lock(boolean guarded, boolean withSafety)
    {
        return lock(guarded, withSafety, null);
    }

    private static Program lock(boolean guarded, boolean withSafety, String constant)
    {
        Program.Builder b = Program.builder();
        Sort node = b.declareSort("node");
        if (constant != null)
            b.declareConstant(constant, false, node);
        b.declareRelation("unlocked", true);
        b.declareRelation("holds", true, node);
        b.declareDerivedRelation("locked", iff(app("locked"), not(app("unlocked"))));

        SortedVar n = new SortedVar("N", node);
        SortedVar x = new SortedVar("X", node);

        b.addInit(and(app("unlocked"), forall(x, not(app("holds", id("X"))))));

        Expr acquire = and(not(app("unlocked")),
                forall(x, iff(app("holds", id("X")), or(old(app("holds", id("X"))), eq(id("X"), id("N"))))));
        if (guarded)
            acquire = and(old(app("unlocked")), acquire);
        b.addTransition("acquire", Collections.singletonList(n), acquire, "unlocked", "holds");

        Expr release = and(old(app("holds", id("N"))), app("unlocked"),
                forall(x, iff(app("holds", id("X")), and(old(app("holds", id("X"))), neq(id("X"), id("N"))))));
        b.addTransition("release", Collections.singletonList(n), release, "unlocked", "holds");

        if (withSafety)
            b.addSafety("mutex", mutex(node));
        return b.build();
    }

    static Expr mutex(Sort node)
    {
        return mutex("holds", node);
    }

    /**
     * Nobody holds the lock while it is free.
     **/
    static Expr free(Sort node)
    {
        SortedVar x = new SortedVar("X", node);
        return forall(x, or(not(app("holds", id("X"))), not(app("unlocked"))));
    }

    /**
     * The lock service with its inductive invariant declared next to the
     * safety property.
     **/
    static Program lockWithInvariant(boolean strengthened)
    {
        Program.Builder b = Program.builder();
        Sort node = b.declareSort("node");
        b.declareRelation("unlocked", true);
        b.declareRelation("holds", true, node);
        SortedVar n = new SortedVar("N", node);
        SortedVar x = new SortedVar("X", node);
        b.addInit(and(app("unlocked"), forall(x, not(app("holds", id("X"))))));
        b.addTransition("acquire", Collections.singletonList(n),
                and(old(app("unlocked")), not(app("unlocked")),
                        forall(x, iff(app("holds", id("X")),
                                or(old(app("holds", id("X"))), eq(id("X"), id("N")))))),
                "unlocked", "holds");
        b.addTransition("release", Collections.singletonList(n),
                and(old(app("holds", id("N"))), app("unlocked"),
                        forall(x, iff(app("holds", id("X")),
                                and(old(app("holds", id("X"))), neq(id("X"), id("N")))))),
                "unlocked", "holds");
        b.addSafety("mutex", mutex(node));
        if (strengthened)
            b.addInvariant("free", free(node));
        return b.build();
    }

    /**
     * A token passed from a node to its fixed successor, starting at the
     * leader. Exactly one node holds it.
     **/
    static Program token()
    {
        Program.Builder b = Program.builder();
        Sort node = b.declareSort("node");
        b.declareConstant("leader", false, node);
        b.declareFunction("next", false, node, node);
        b.declareRelation("has_token", true, node);
        b.declareConstant("last", true, node);

        SortedVar n = new SortedVar("N", node);
        SortedVar x = new SortedVar("X", node);

        b.addInit(forall(x, iff(app("has_token", id("X")), eq(id("X"), id("leader")))));
        b.addInit(eq(id("last"), id("leader")));
        b.addTransition("pass", Collections.singletonList(n),
                and(old(app("has_token", id("N"))), eq(id("last"), id("N")),
                        forall(x, iff(app("has_token", id("X")), eq(id("X"), app("next", id("N")))))),
                "has_token", "last");
        b.addSafety("one_token", mutex("has_token", node));
        return b.build();
    }

    static Expr mutex(String relation, Sort node)
    {
        SortedVar x = new SortedVar("X", node);
        SortedVar y = new SortedVar("Y", node);
        return forall(Arrays.asList(x, y),
                implies(and(app(relation, id("X")), app(relation, id("Y"))), eq(id("X"), id("Y"))));
    }

    /**
     * A program whose initial states already violate safety.
     **/
    static Program brokenInit()
    {
        Program.Builder b = Program.builder();
        Sort node = b.declareSort("node");
        b.declareRelation("holds", true, node);
        SortedVar x = new SortedVar("X", node);
        b.addInit(exists(x, app("holds", id("X"))));
        b.addTransition("stay", Collections.<SortedVar>emptyList(), TRUE);
        b.addSafety(forall(x, not(app("holds", id("X")))));
        return b.build();
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    ResultKind.java

Abstract:

Notes:
    
**/ 

package org.updr.enumerations;

/**
 * Verdicts of an invariant search.
 **/
public enum ResultKind
{
    // / The safety property has an inductive strengthening.
    PROVED(1),

    // / A counterexample chain reached the initial states.
    DISPROVED(-1),

    // / The search stopped before a verdict and can be resumed.
    INTERRUPTED(0);

    private final int intValue;

    ResultKind(int v)
    {
        this.intValue = v;
    }

    public static ResultKind fromInt(int v)
    {
        for (ResultKind k : values())
            if (k.intValue == v)
                return k;
        return values()[0];
    }

    public final int toInt()
    {
        return this.intValue;
    }
}

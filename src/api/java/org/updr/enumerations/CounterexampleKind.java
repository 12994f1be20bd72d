/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    CounterexampleKind.java

Abstract:

Notes:
    
**/ 

package org.updr.enumerations;

/**
 * What a counterexample refutes.
 **/
public enum CounterexampleKind
{
    // / An initial state violates the property.
    INIT("init"),

    // / A state satisfying the invariants steps to one violating them.
    CTI("cti"),

    // / A run from the initial states ends in a safety violation.
    TRACE("trace");

    private final String m_name;

    CounterexampleKind(String name)
    {
        m_name = name;
    }

    /**
     * The name used in machine-readable output.
     **/
    public String getName()
    {
        return m_name;
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    GeneralizationStrategy.java

Abstract:

Notes:
    
**/ 

package org.updr.enumerations;

/**
 * Diagram minimization strategies.
 **/
public enum GeneralizationStrategy
{
    // / Try dropping every literal and keep each removal that still blocks.
    BRUTE_FORCE,

    // / Keep only the literals of the unsat core, then drop literals one by one.
    UNSAT_CORE
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    TransitionOrder.java

Abstract:

Notes:
    
**/ 

package org.updr.enumerations;

/**
 * Order in which transitions are tried when looking for a predecessor.
 **/
public enum TransitionOrder
{
    // / Declaration order of the program.
    DECLARED,

    // / Lowest average query time first, declaration order on ties.
    FASTEST_FIRST
}

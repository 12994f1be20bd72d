/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    ExprKind.java

Abstract:

Notes:
    
**/ 

package org.updr.enumerations;

/**
 * The kinds of formula and term nodes.
 **/
public enum ExprKind
{
    BOOL_LITERAL, ID, APP, NOT, OLD, AND, OR, IMPLIES, IFF, EQ, NEQ, ITE, FORALL, EXISTS;

    /**
     * Indicates whether nodes of this kind bind variables.
     **/
    public boolean isQuantifier()
    {
        return this == FORALL || this == EXISTS;
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    SymbolKind.java

Abstract:

Notes:
    
**/ 

package org.updr.enumerations;

/**
 * The kinds of declared symbols.
 **/
public enum SymbolKind
{
    RELATION, CONSTANT, FUNCTION
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    DiagramGroupKind.java

Abstract:

Notes:
    
**/ 

package org.updr.enumerations;

/**
 * The declaration a diagram literal constrains.
 **/
public enum DiagramGroupKind
{
    // / Pairwise distinctness of the elements of one sort.
    INEQUALITY,
    RELATION,
    CONSTANT,
    FUNCTION
}

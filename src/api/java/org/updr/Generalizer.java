/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Generalizer.java

Abstract:

Notes:
    
**/ 

package org.updr;

/**
 * Weakens a blocked diagram into a predicate.
 **/
public interface Generalizer
{
    /**
     * Removes literals from {@code diagram} while {@code context} still
     * reports it blocked, and returns the negation of what is left.
     **/
    Expr generalize(Diagram diagram, BlockingContext context);
}

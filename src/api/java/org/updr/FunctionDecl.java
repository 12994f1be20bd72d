/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    FunctionDecl.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.List;

import org.updr.enumerations.SymbolKind;

/**
 * A function declaration with an uninterpreted range.
 **/
public final class FunctionDecl extends SymbolDecl
{
    private final Sort m_range;

    FunctionDecl(String name, boolean mutable, List<Sort> domain, Sort range)
    {
        super(name, mutable, domain);
        m_range = range;
    }

    @Override
    public Sort getRange()
    {
        return m_range;
    }

    @Override
    public SymbolKind getKind()
    {
        return SymbolKind.FUNCTION;
    }
}

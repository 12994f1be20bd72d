/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    ConstantDecl.java

Abstract:

Notes:
    
**/ 

package org.updr;

import com.google.common.collect.ImmutableList;

import org.updr.enumerations.SymbolKind;

/**
 * A constant declaration.
 **/
public final class ConstantDecl extends SymbolDecl
{
    private final Sort m_sort;

    ConstantDecl(String name, boolean mutable, Sort sort)
    {
        super(name, mutable, ImmutableList.<Sort>of());
        m_sort = sort;
    }

    @Override
    public Sort getRange()
    {
        return m_sort;
    }

    @Override
    public SymbolKind getKind()
    {
        return SymbolKind.CONSTANT;
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    RelationDecl.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.List;

import org.updr.enumerations.SymbolKind;

/**
 * A relation declaration. A derived relation carries the closed axiom that
 * defines it.
 **/
public final class RelationDecl extends SymbolDecl
{
    private final Expr m_derivedAxiom;

    RelationDecl(String name, boolean mutable, List<Sort> domain, Expr derivedAxiom)
    {
        super(name, mutable, domain);
        m_derivedAxiom = derivedAxiom;
    }

    @Override
    public Sort getRange()
    {
        return Sort.BOOL;
    }

    @Override
    public SymbolKind getKind()
    {
        return SymbolKind.RELATION;
    }

    @Override
    public boolean isDerived()
    {
        return m_derivedAxiom != null;
    }

    /**
     * The defining axiom, or null for relations chosen freely by models.
     **/
    public Expr getDerivedAxiom()
    {
        return m_derivedAxiom;
    }
}

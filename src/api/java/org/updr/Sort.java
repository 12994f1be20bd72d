/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    Sort.java

Abstract:

Notes:
    
**/ 

package org.updr;

import com.google.common.base.Preconditions;

/**
 * An uninterpreted sort. The boolean sort is used only for checking formulas;
 * variables, constants and function ranges are always uninterpreted.
 **/
public final class Sort
{
    /**
     * The sort of formulas.
     **/
    public static final Sort BOOL = new Sort("bool");

    private final String m_name;

    Sort(String name)
    {
        m_name = Preconditions.checkNotNull(name);
    }

    /**
     * The name of the sort.
     **/
    public String getName()
    {
        return m_name;
    }

    /**
     * Indicates whether this is the sort of formulas.
     **/
    public boolean isBool()
    {
        return this == BOOL;
    }

    @Override
    public boolean equals(Object o)
    {
        if (o == this)
            return true;
        if (!(o instanceof Sort))
            return false;
        return m_name.equals(((Sort) o).m_name);
    }

    @Override
    public int hashCode()
    {
        return m_name.hashCode();
    }

    @Override
    public String toString()
    {
        return m_name;
    }
}

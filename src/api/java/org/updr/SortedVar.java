/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    SortedVar.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * A variable together with its sort, as bound by a quantifier or a
 * transition's parameter list.
 **/
public final class SortedVar
{
    private final String m_name;
    private final Sort m_sort;

    public SortedVar(String name, Sort sort)
    {
        m_name = Preconditions.checkNotNull(name);
        m_sort = Preconditions.checkNotNull(sort);
    }

    public String getName()
    {
        return m_name;
    }

    public Sort getSort()
    {
        return m_sort;
    }

    @Override
    public boolean equals(Object o)
    {
        if (o == this)
            return true;
        if (!(o instanceof SortedVar))
            return false;
        SortedVar other = (SortedVar) o;
        return m_name.equals(other.m_name) && m_sort.equals(other.m_sort);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(m_name, m_sort);
    }

    @Override
    public String toString()
    {
        return m_name + ":" + m_sort;
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    QueryStats.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.concurrent.TimeUnit;

/**
 * Counters over the solver queries of a session.
 **/
public final class QueryStats
{
    private int m_count;
    private long m_totalNanos;
    private long m_maxNanos;
    private String m_slowest;

    void record(String description, long nanos)
    {
        m_count++;
        m_totalNanos += nanos;
        if (m_slowest == null || nanos > m_maxNanos)
        {
            m_maxNanos = nanos;
            m_slowest = description;
        }
    }

    /**
     * The number of queries made.
     **/
    public int getCount()
    {
        return m_count;
    }

    public long getTotalMillis()
    {
        return TimeUnit.NANOSECONDS.toMillis(m_totalNanos);
    }

    public long getMaxMillis()
    {
        return TimeUnit.NANOSECONDS.toMillis(m_maxNanos);
    }

    /**
     * The description of the slowest query, or null if none was made.
     **/
    public String getSlowest()
    {
        return m_slowest;
    }

    @Override
    public String toString()
    {
        return m_count + " queries in " + getTotalMillis() + " ms"
                + (m_slowest == null ? "" : ", slowest " + getMaxMillis() + " ms: " + m_slowest);
    }
}

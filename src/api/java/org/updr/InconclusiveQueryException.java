/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    InconclusiveQueryException.java

Abstract:

Notes:
    
**/ 

package org.updr;

/**
 * A solver query returned {@code unknown} and every retry did too.
 **/
@SuppressWarnings("serial")
public class InconclusiveQueryException extends UpdrException
{
    private final String m_query;
    private final String m_reason;

    /**
     * Constructor.
     * @param query description of the query, including frame and obligation
     * @param reason the reason reported by the solver
     **/
    public InconclusiveQueryException(String query, String reason)
    {
        super("inconclusive query: " + query + " (" + reason + ")");
        m_query = query;
        m_reason = reason;
    }

    /**
     * The description of the offending query.
     **/
    public String getQuery()
    {
        return m_query;
    }

    /**
     * The solver's reason for returning {@code unknown}.
     **/
    public String getReason()
    {
        return m_reason;
    }
}

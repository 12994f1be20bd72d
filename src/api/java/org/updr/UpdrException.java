/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    UpdrException.java

Abstract:

Notes:
    
**/ 

package org.updr;

/**
 * The exception base class for error reporting from the invariant search.
 **/
@SuppressWarnings("serial")
public class UpdrException extends RuntimeException
{
    /**
     * Constructor.
     **/
    public UpdrException()
    {
        super();
    }

    /**
     * Constructor.
     **/
    public UpdrException(String message)
    {
        super(message);
    }

    /**
     * Constructor.
     **/
    public UpdrException(String message, Exception inner)
    {
        super(message, inner);
    }
}

/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    InternalInvariantException.java

Abstract:

Notes:
    
**/ 

package org.updr;

/**
 * A property the search relies on was found violated. This always indicates
 * a bug and must not be recovered from.
 **/
@SuppressWarnings("serial")
public class InternalInvariantException extends UpdrException
{
    /**
     * Constructor.
     **/
    public InternalInvariantException(String message)
    {
        super(message);
    }
}

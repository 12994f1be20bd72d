/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    CheckpointException.java

Abstract:

Notes:
    
**/ 

package org.updr;

/**
 * A checkpoint could not be written or read back.
 **/
@SuppressWarnings("serial")
public class CheckpointException extends UpdrException
{
    /**
     * Constructor.
     **/
    public CheckpointException(String message)
    {
        super(message);
    }

    /**
     * Constructor.
     **/
    public CheckpointException(String message, Exception inner)
    {
        super(message, inner);
    }
}

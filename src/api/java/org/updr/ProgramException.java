/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    ProgramException.java

Abstract:

Notes:
    
**/ 

package org.updr;

/**
 * A program model failed validation.
 **/
@SuppressWarnings("serial")
public class ProgramException extends UpdrException
{
    /**
     * Constructor.
     **/
    public ProgramException(String message)
    {
        super(message);
    }
}

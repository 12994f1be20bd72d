/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    PushFrameZero.java

Abstract:

Notes:
    
**/ 

package org.updr.enumerations;

/**
 * Whether predicates of frame 0 are pushed into frame 1.
 **/
public enum PushFrameZero
{
    ALWAYS, NEVER
}

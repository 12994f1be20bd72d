/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    UnsatCoreGeneralizer.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the literals of the unsat core gathered while refuting
 * predecessors, then minimizes further by brute force.
 **/
public final class UnsatCoreGeneralizer implements Generalizer
{
    private static final Logger logger = LoggerFactory.getLogger(UnsatCoreGeneralizer.class);

    private final Generalizer m_bruteForce = new BruteForceGeneralizer();

    @Override
    public Expr generalize(Diagram diagram, BlockingContext context)
    {
        Set<Integer> core = context.getCore();
        if (core != null)
        {
            int before = diagram.size();
            diagram.retainOnly(core);
            if (!context.isBlocked(diagram))
                throw new InternalInvariantException("unsat core " + diagram + " does not block at frame "
                        + context.getFrame());
            logger.debug("unsat core keeps {} of {} literals", diagram.size(), before);
        }
        return m_bruteForce.generalize(diagram, context);
    }
}

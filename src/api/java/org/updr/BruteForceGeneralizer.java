/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    BruteForceGeneralizer.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.updr.enumerations.DiagramGroupKind;

/**
 * Tries to drop each declaration group, then the positive literals of each
 * relation, then every literal on its own. The result is locally minimal:
 * no single remaining literal can be dropped.
 **/
public final class BruteForceGeneralizer implements Generalizer
{
    private static final Logger logger = LoggerFactory.getLogger(BruteForceGeneralizer.class);

    @Override
    public Expr generalize(Diagram diagram, BlockingContext context)
    {
        int before = diagram.size();
        for (Map.Entry<Diagram.Group, List<Integer>> g : diagram.groups().entrySet())
        {
            List<Integer> lits = g.getValue();
            DiagramGroupKind kind = g.getKey().getKind();
            if (kind == DiagramGroupKind.INEQUALITY && lits.size() == 1)
                continue;
            if (tryRemove(diagram, context, lits, g.getKey().toString()))
                continue;
            if (kind == DiagramGroupKind.RELATION)
            {
                List<Integer> positive = new ArrayList<Integer>();
                for (int i : lits)
                    if (diagram.isPositive(i))
                        positive.add(i);
                if (!positive.isEmpty() && positive.size() < lits.size())
                    tryRemove(diagram, context, positive, "positive literals of " + g.getKey());
            }
        }
        for (int i : diagram.activeIndices())
            tryRemove(diagram, context, Collections.singletonList(i), diagram.getConjunct(i).toString());
        diagram.pruneUnusedVars();
        logger.debug("generalized from {} to {} literals at frame {}", before, diagram.size(), context.getFrame());
        return diagram.toPredicate();
    }

    private static boolean tryRemove(Diagram diagram, BlockingContext context, List<Integer> lits, String what)
    {
        diagram.remove(lits);
        if (context.isBlocked(diagram))
        {
            logger.debug("dropped {}", what);
            return true;
        }
        diagram.restore(lits);
        return false;
    }
}

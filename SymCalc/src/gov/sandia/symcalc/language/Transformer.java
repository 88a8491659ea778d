/*
Copyright 2013 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    Rewrite hook passed down an expression tree by Operator.transform().
    Nodes are modified in place, so substitute() runs it over a deepCopy() of the caller's tree.
**/
public class Transformer
{
    /**
        @return A replacement for the given node, which is then not descended into.
        Returning null keeps the node and lets it pass the transformer on to its operands.
    **/
    public Operator transform (Operator op)
    {
        return null;
    }
}

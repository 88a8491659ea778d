/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    Accumulates the infix form of an expression, as produced by Operator.render().
    Every binary node is wrapped in parentheses, functions print as name(arg),
    and deferred nodes print as d/dv(e) or the integral sign followed by e dv.
**/
public class Renderer
{
    public StringBuilder result;

    public Renderer ()
    {
        result = new StringBuilder ();
    }

    public Renderer (StringBuilder result)
    {
        this.result = result;
    }

    /**
        Override point for printing a particular node differently.
        @return true if op was appended to result here. false to use the node's own infix form.
    **/
    public boolean render (Operator op)
    {
        return false;
    }
}

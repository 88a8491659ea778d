/*
Copyright 2020-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    No differentiation or integration rule matches the shape of an expression.
    This is an expected outcome rather than a fault. Callers either report it or keep the
    operation in deferred form (see Derivative and Integral).
**/
@SuppressWarnings("serial")
public class UnresolvedException extends Exception
{
    public String expression;  // rendered infix form of the node that could not be resolved
    public String reason;

    public UnresolvedException (Operator op, String reason)
    {
        super (reason + ": " + op.render ());
        expression  = op.render ();
        this.reason = reason;
    }
}

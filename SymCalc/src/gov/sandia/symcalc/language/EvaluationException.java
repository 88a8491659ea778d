/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    Numeric evaluation hit a node it cannot reduce to a number, such as a free symbol.
    This is a broken precondition on the part of the caller, so it is unchecked.
**/
@SuppressWarnings("serial")
public class EvaluationException extends RuntimeException
{
    public EvaluationException (String message)
    {
        super (message);
    }
}

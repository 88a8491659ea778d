/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.function;

import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Symbol;

public class Exp extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "exp";
            }

            public Operator createInstance ()
            {
                return new Exp ();
            }
        };
    }

    public Exp ()
    {
    }

    public Exp (Operator argument)
    {
        operands[0] = argument;
    }

    public double apply (double x)
    {
        return Math.exp (x);
    }

    public Operator derivativeAt (Operator u)
    {
        return new Exp (u);
    }

    public Operator antiderivative (Symbol x)
    {
        return new Exp (new Symbol (x.name));
    }

    public String toString ()
    {
        return "exp";
    }
}

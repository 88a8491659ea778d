/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.function;

import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Symbol;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.type.Rational;

public class Cosine extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "cos";
            }

            public Operator createInstance ()
            {
                return new Cosine ();
            }
        };
    }

    public Cosine ()
    {
    }

    public Cosine (Operator argument)
    {
        operands[0] = argument;
    }

    public double apply (double x)
    {
        return Math.cos (x);
    }

    public Operator derivativeAt (Operator u)
    {
        return new Multiply (new Constant (Rational.MINUS_ONE), new Sine (u));
    }

    public Operator antiderivative (Symbol x)
    {
        return new Sine (new Symbol (x.name));
    }

    public String toString ()
    {
        return "cos";
    }
}

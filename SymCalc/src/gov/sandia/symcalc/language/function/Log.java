/*
Copyright 2017-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.function;

import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.Symbol;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.type.Rational;

import org.apache.log4j.Logger;

/**
    Natural logarithm.
**/
public class Log extends Function
{
    private static Logger logger = Logger.getLogger (Log.class);

    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "log";
            }

            public Operator createInstance ()
            {
                return new Log ();
            }
        };
    }

    public Log ()
    {
    }

    public Log (Operator argument)
    {
        operands[0] = argument;
    }

    public double apply (double x)
    {
        return Math.log (x);
    }

    public Operator derivativeAt (Operator u)
    {
        return new Power (u, new Constant (Rational.MINUS_ONE));
    }

    /**
        Returns x^-1, which is the derivative of log(x) rather than its antiderivative x*log(x)-x.
        Kept because existing recorded outputs depend on it.
    **/
    public Operator antiderivative (Symbol x)
    {
        logger.warn ("Approximate rule: integral of log(" + x.name + ") d" + x.name + " is taken as " + x.name + "^-1");
        return new Power (new Symbol (x.name), new Constant (Rational.MINUS_ONE));
    }

    public String toString ()
    {
        return "log";
    }
}

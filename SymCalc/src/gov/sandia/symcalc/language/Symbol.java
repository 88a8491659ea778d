/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.type.Rational;

/**
    An opaque named quantity. There is no binding or scope, so two symbols are the same
    exactly when their names are.
**/
public class Symbol extends Operator
{
    public String name;

    public Symbol (String name)
    {
        this.name = Identifier.canonical (name);
    }

    public boolean is (String variable)
    {
        return name.equals (variable);
    }

    public Operator derivative (String variable)
    {
        if (is (variable)) return new Constant (Rational.ONE);
        return new Constant (Rational.ZERO);
    }

    /**
        Any symbol other than the variable of integration is treated as a constant.
    **/
    public Operator integral (String variable)
    {
        if (is (variable)) return new Multiply (new Constant (Rational.HALF), new Power (new Symbol (variable), new Constant (Rational.TWO)));
        return new Multiply (new Symbol (name), new Symbol (variable));
    }

    public double eval ()
    {
        throw new EvaluationException ("Cannot evaluate expression with free symbol: " + name);
    }

    public Operator evaluate (String target, Rational value)
    {
        if (is (target)) return new Constant (value);
        return this;
    }

    public String label ()
    {
        return "SYMBOL: " + name;
    }

    public String toString ()
    {
        return name;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Symbol)) return false;
        Symbol s = (Symbol) that;
        return name.equals (s.name);
    }

    public int hashCode ()
    {
        return name.hashCode ();
    }
}

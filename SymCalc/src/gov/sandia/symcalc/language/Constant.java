/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.type.Rational;

public class Constant extends Operator
{
    public Rational value;

    public Constant (Rational value)
    {
        this.value = value;
    }

    public Constant (long value)
    {
        this.value = new Rational (value);
    }

    public Operator derivative (String variable)
    {
        return new Constant (Rational.ZERO);
    }

    public Operator integral (String variable)
    {
        return new Multiply (new Constant (value), new Symbol (variable));
    }

    public double eval ()
    {
        return value.doubleValue ();
    }

    public boolean isScalar ()
    {
        return true;
    }

    public Rational getRational ()
    {
        return value;
    }

    public String label ()
    {
        return "NUMBER: " + value;
    }

    public String toString ()
    {
        return value.toString ();
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Constant)) return false;
        Constant c = (Constant) that;
        return value.equals (c.value);
    }

    public int hashCode ()
    {
        return value.hashCode ();
    }
}

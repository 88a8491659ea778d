/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.operator;

import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.OperatorBinary;
import gov.sandia.symcalc.language.Symbol;
import gov.sandia.symcalc.language.UnresolvedException;
import gov.sandia.symcalc.language.function.Log;
import gov.sandia.symcalc.language.type.Rational;

/**
    operand0 is the base and operand1 is the exponent.
**/
public class Power extends OperatorBinary
{
    public Power ()
    {
    }

    public Power (Operator base, Operator exponent)
    {
        super (base, exponent);
    }

    public Operator simplify ()
    {
        Operator base     = operand0.simplify ();
        Operator exponent = operand1.simplify ();

        // Cases we can simplify, in this order:
        // a^0 = 1
        // a^1 = a
        // 0^b = 0  (no guard for b=0, but the first case catches 0^0)
        // 1^b = 1
        // A numeric base with numeric exponent is left as is.
        if (exponent.isScalar (Rational.ZERO)) return new Constant (Rational.ONE);
        if (exponent.isScalar (Rational.ONE )) return base;
        if (base    .isScalar (Rational.ZERO)) return new Constant (Rational.ZERO);
        if (base    .isScalar (Rational.ONE )) return new Constant (Rational.ONE);
        return with (base, exponent);
    }

    /**
        Applies only to x^n where x is the variable itself and n is a number.
    **/
    public boolean isMonomialIn (String variable)
    {
        return operand1.isScalar ()  &&  operand0 instanceof Symbol  &&  ((Symbol) operand0).is (variable);
    }

    public Operator derivative (String variable) throws UnresolvedException
    {
        if (! isMonomialIn (variable)) throw new UnresolvedException (this, "Power rule for general expressions not implemented");
        Rational n = operand1.getRational ();
        return new Multiply (new Constant (n), new Power (new Symbol (variable), new Constant (n.subtract (Rational.ONE))));
    }

    /**
        x^n integrates to x^(n+1)/(n+1), except that x^-1 integrates to log(x).
    **/
    public Operator integral (String variable) throws UnresolvedException
    {
        if (! isMonomialIn (variable)) throw new UnresolvedException (this, "Power rule for general expressions not implemented");
        Rational n1 = operand1.getRational ().add (Rational.ONE);
        if (n1.isZero ()) return new Log (new Symbol (variable));
        Constant coefficient = new Constant (Rational.ONE.divide (n1));
        return new Multiply (coefficient, new Power (new Symbol (variable), new Constant (n1)));
    }

    public double eval ()
    {
        return Math.pow (operand0.eval (), operand1.eval ());
    }

    public String label ()
    {
        return "POW";
    }

    public String toString ()
    {
        return "^";
    }
}

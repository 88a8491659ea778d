/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.operator;

import gov.sandia.symcalc.language.Constant;
import gov.sandia.symcalc.language.Function;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.OperatorBinary;
import gov.sandia.symcalc.language.Symbol;
import gov.sandia.symcalc.language.UnresolvedException;
import gov.sandia.symcalc.language.type.Rational;

public class Add extends OperatorBinary
{
    public Add ()
    {
    }

    public Add (Operator operand0, Operator operand1)
    {
        super (operand0, operand1);
    }

    public Operator simplify ()
    {
        Operator a = operand0.simplify ();
        Operator b = operand1.simplify ();

        if (a.isScalar ()  &&  b.isScalar ()) return new Constant (a.getRational ().add (b.getRational ()));
        if (a.isScalar (Rational.ZERO)) return b;  // 0+B --> B
        if (b.isScalar (Rational.ZERO)) return a;  // A+0 --> A

        // A+c --> c+A
        if (b.isScalar ()  &&  (a instanceof Symbol  ||  a instanceof Function  ||  a instanceof Multiply  ||  a instanceof Add))
        {
            return new Add (b, a).simplify ();
        }

        // a*X + b*X --> (a+b)*X
        if (a instanceof Multiply  &&  b instanceof Multiply)
        {
            Multiply ma = (Multiply) a;
            Multiply mb = (Multiply) b;
            if (ma.operand1.equals (mb.operand1))
            {
                return new Multiply (new Add (ma.operand0, mb.operand0), ma.operand1).simplify ();
            }
        }

        return with (a, b);
    }

    /**
        Sum rule.
    **/
    public Operator derivative (String variable) throws UnresolvedException
    {
        return new Add (operand0.derivative (variable), operand1.derivative (variable));
    }

    public Operator integral (String variable) throws UnresolvedException
    {
        return new Add (operand0.integral (variable), operand1.integral (variable));
    }

    public double eval ()
    {
        return operand0.eval () + operand1.eval ();
    }

    public Operator evaluate (String name, Rational value)
    {
        Operator a = operand0.evaluate (name, value);
        Operator b = operand1.evaluate (name, value);
        if (a.isScalar ()  &&  b.isScalar ()) return new Constant (a.getRational ().add (b.getRational ()));
        return with (a, b);
    }

    public String label ()
    {
        return "ADD";
    }

    public String toString ()
    {
        return "+";
    }
}

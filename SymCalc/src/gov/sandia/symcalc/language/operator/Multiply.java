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

public class Multiply extends OperatorBinary
{
    public Multiply ()
    {
    }

    public Multiply (Operator operand0, Operator operand1)
    {
        super (operand0, operand1);
    }

    public Operator simplify ()
    {
        Operator a = operand0.simplify ();
        Operator b = operand1.simplify ();

        if (a.isScalar ()  &&  b.isScalar ()) return new Constant (a.getRational ().multiply (b.getRational ()));

        if (a.isScalar ())
        {
            Rational value = a.getRational ();
            if (value.isOne  ()) return b;
            if (value.isZero ()) return new Constant (Rational.ZERO);
        }
        else if (b.isScalar ())
        {
            Rational value = b.getRational ();
            if (value.isOne  ()) return a;
            if (value.isZero ()) return new Constant (Rational.ZERO);
        }

        // A*c --> c*A
        if (b.isScalar ()  &&  (a instanceof Symbol  ||  a instanceof Function  ||  a instanceof Multiply  ||  a instanceof Add))
        {
            return new Multiply (b, a).simplify ();
        }

        // Absorb the coefficient one level down.
        if (a.isScalar ())
        {
            if (b instanceof Multiply  &&  ((Multiply) b).operand0.isScalar ())  // k*(c*X) --> (k*c)*X
            {
                Multiply m = (Multiply) b;
                Constant k = new Constant (a.getRational ().multiply (m.operand0.getRational ()));
                return new Multiply (k, m.operand1).simplify ();
            }
            if (b instanceof Add  &&  ((Add) b).operand0.isScalar ())  // k*(c+X) --> k*c + k*X
            {
                Add s = (Add) b;
                return new Add (new Multiply (a, s.operand0), new Multiply (a, s.operand1)).simplify ();
            }
        }

        if (a.equals (b)) return new Power (a, new Constant (Rational.TWO)).simplify ();  // X*X --> X^2

        // X^a * X^b --> X^(a+b)
        if (a instanceof Power  &&  b instanceof Power)
        {
            Power pa = (Power) a;
            Power pb = (Power) b;
            if (pa.operand0.equals (pb.operand0))
            {
                return new Power (pa.operand0, new Add (pa.operand1, pb.operand1)).simplify ();
            }
        }

        return with (a, b);
    }

    /**
        Product rule.
    **/
    public Operator derivative (String variable) throws UnresolvedException
    {
        Operator df = operand0.derivative (variable);
        Operator dg = operand1.derivative (variable);
        return new Add (new Multiply (df, operand1.deepCopy ()), new Multiply (operand0.deepCopy (), dg));
    }

    /**
        Only a product with a numeric factor can be integrated. Integration by parts is not attempted.
    **/
    public Operator integral (String variable) throws UnresolvedException
    {
        if (operand1.isScalar ()) return new Multiply (operand1.deepCopy (), operand0.integral (variable));
        if (operand0.isScalar ()) return new Multiply (operand0.deepCopy (), operand1.integral (variable));
        throw new UnresolvedException (this, "Integration of a general product is not implemented");
    }

    public double eval ()
    {
        return operand0.eval () * operand1.eval ();
    }

    public Operator evaluate (String name, Rational value)
    {
        Operator a = operand0.evaluate (name, value);
        Operator b = operand1.evaluate (name, value);
        if (a.isScalar ()  &&  b.isScalar ()) return new Constant (a.getRational ().multiply (b.getRational ()));
        return with (a, b);
    }

    public String label ()
    {
        return "MUL";
    }

    public String toString ()
    {
        return "*";
    }
}

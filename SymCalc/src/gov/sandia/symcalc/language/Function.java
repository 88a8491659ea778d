/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.type.Rational;

/**
    Elementary function of a single argument.
    Subclasses supply the numeric implementation, the derivative of the outer function
    and the antiderivative with respect to a bare variable.
**/
public abstract class Function extends Operator
{
    public Operator[] operands = new Operator[1];

    /**
        Numeric value of this function at the given point.
    **/
    public abstract double apply (double x);

    /**
        f'(u), the derivative of the outer function evaluated at the argument.
        The chain rule multiplies this by du.
    **/
    public abstract Operator derivativeAt (Operator u);

    /**
        Antiderivative of f(x) with respect to x, where x is the bare variable of integration.
    **/
    public abstract Operator antiderivative (Symbol x);

    public Operator deepCopy ()
    {
        Function result = (Function) super.deepCopy ();
        result.operands = new Operator[] {operands[0].deepCopy ()};
        return result;
    }

    public Function with (Operator argument)
    {
        if (argument == operands[0]) return this;
        Function result;
        try
        {
            result = (Function) this.clone ();
        }
        catch (CloneNotSupportedException e)
        {
            throw new Error ("Operator must be cloneable", e);
        }
        result.operands = new Operator[] {argument};
        return result;
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        operands[0] = operands[0].transform (transformer);
        return this;
    }

    /**
        Only the argument is simplified. Identities such as log(exp(x)) are not folded.
    **/
    public Operator simplify ()
    {
        return with (operands[0].simplify ());
    }

    public Operator derivative (String variable) throws UnresolvedException
    {
        Operator u  = operands[0];
        Operator du = u.derivative (variable);
        return new Multiply (derivativeAt (u.deepCopy ()), du);
    }

    /**
        There is no chain rule for integration, so the argument must be the variable itself.
    **/
    public Operator integral (String variable) throws UnresolvedException
    {
        Operator u = operands[0];
        if (! (u instanceof Symbol)  ||  ! ((Symbol) u).is (variable))
        {
            throw new UnresolvedException (this, "Integration of " + toString () + " is only supported for a bare d" + variable);
        }
        return antiderivative ((Symbol) u);
    }

    public double eval ()
    {
        return apply (operands[0].eval ());
    }

    public Operator evaluate (String name, Rational value)
    {
        Operator argument = operands[0].evaluate (name, value);
        if (argument.isScalar ())
        {
            double result = apply (argument.getRational ().doubleValue ());
            if (! Double.isNaN (result)  &&  ! Double.isInfinite (result)) return new Constant (Rational.valueOf (result));  // approximate
        }
        return with (argument);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (toString ());
        renderer.result.append ("(");
        operands[0].render (renderer);
        renderer.result.append (")");
    }

    public void dump (StringBuilder result, int indent, String prefix)
    {
        super.dump (result, indent, prefix);
        operands[0].dump (result, indent + 4, "└── ");
    }

    public String label ()
    {
        return "FUNC: " + toString ();
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        Function f = (Function) that;
        return operands[0].equals (f.operands[0]);
    }

    public int hashCode ()
    {
        return getClass ().hashCode () ^ operands[0].hashCode ();
    }
}

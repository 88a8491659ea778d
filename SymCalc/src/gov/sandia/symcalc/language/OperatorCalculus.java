/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import gov.sandia.symcalc.language.type.Rational;

import org.apache.log4j.Logger;

/**
    Deferred calculus operation on a single operand with respect to a named variable.
    The operation is only carried out when simplify() forces it.
**/
public abstract class OperatorCalculus extends Operator
{
    public Operator operand;
    public String   variable;

    private static Logger logger = Logger.getLogger (OperatorCalculus.class);

    public OperatorCalculus (Operator operand, String variable)
    {
        this.operand  = operand;
        this.variable = Identifier.canonical (variable);
    }

    /**
        Applies the operation to an already simplified operand.
        @throws UnresolvedException if the operation has no rule for the operand.
    **/
    public abstract Operator force (Operator inner) throws UnresolvedException;

    public Operator deepCopy ()
    {
        OperatorCalculus result = (OperatorCalculus) super.deepCopy ();
        result.operand = operand.deepCopy ();
        return result;
    }

    public OperatorCalculus with (Operator inner)
    {
        if (inner == operand) return this;
        OperatorCalculus result;
        try
        {
            result = (OperatorCalculus) this.clone ();
        }
        catch (CloneNotSupportedException e)
        {
            throw new Error ("Operator must be cloneable", e);
        }
        result.operand = inner;
        return result;
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        operand = operand.transform (transformer);
        return this;
    }

    /**
        Normalizes the operand first, then attempts to force the operation. If no rule applies,
        the node is kept in symbolic form around the normalized operand.
    **/
    public Operator simplify ()
    {
        Operator inner = operand.simplify ();
        try
        {
            return force (inner).simplify ();
        }
        catch (UnresolvedException e)
        {
            logger.debug ("Keeping " + label () + " deferred. " + e.getMessage ());
            return with (inner);
        }
    }

    public double eval ()
    {
        throw new EvaluationException ("Cannot evaluate deferred operation: " + render ());
    }

    public Operator evaluate (String name, Rational value)
    {
        if (variable.equals (name)) return this;  // bound variable
        return with (operand.evaluate (name, value));
    }

    public void dump (StringBuilder result, int indent, String prefix)
    {
        super.dump (result, indent, prefix);
        operand.dump (result, indent + 4, "└── ");
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        OperatorCalculus o = (OperatorCalculus) that;
        return variable.equals (o.variable)  &&  operand.equals (o.operand);
    }

    public int hashCode ()
    {
        return getClass ().hashCode () ^ (31 * variable.hashCode () + operand.hashCode ());
    }
}

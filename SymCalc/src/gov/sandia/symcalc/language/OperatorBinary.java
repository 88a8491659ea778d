/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import gov.sandia.symcalc.language.type.Rational;

/**
    Sum, product or power. Operand order is stored as given. Commutativity is left to simplify().
**/
public class OperatorBinary extends Operator
{
    public Operator operand0;
    public Operator operand1;

    public OperatorBinary ()
    {
    }

    public OperatorBinary (Operator operand0, Operator operand1)
    {
        this.operand0 = operand0;
        this.operand1 = operand1;
    }

    public Operator deepCopy ()
    {
        OperatorBinary result = (OperatorBinary) super.deepCopy ();
        result.operand0 = operand0.deepCopy ();
        result.operand1 = operand1.deepCopy ();
        return result;
    }

    /**
        Shallow copy of this node with the given operands. Returns this node itself if neither operand changed.
    **/
    public OperatorBinary with (Operator a, Operator b)
    {
        if (a == operand0  &&  b == operand1) return this;
        OperatorBinary result;
        try
        {
            result = (OperatorBinary) this.clone ();
        }
        catch (CloneNotSupportedException e)
        {
            throw new Error ("Operator must be cloneable", e);
        }
        result.operand0 = a;
        result.operand1 = b;
        return result;
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        operand0 = operand0.transform (transformer);
        operand1 = operand1.transform (transformer);
        return this;
    }

    public Operator evaluate (String name, Rational value)
    {
        return with (operand0.evaluate (name, value), operand1.evaluate (name, value));
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append ("(");
        operand0.render (renderer);
        renderer.result.append (" " + toString () + " ");
        operand1.render (renderer);
        renderer.result.append (")");
    }

    public void dump (StringBuilder result, int indent, String prefix)
    {
        super.dump (result, indent, prefix);
        operand0.dump (result, indent + 4, "├── ");
        operand1.dump (result, indent + 4, "└── ");
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        OperatorBinary o = (OperatorBinary) that;
        return operand0.equals (o.operand0)  &&  operand1.equals (o.operand1);
    }

    public int hashCode ()
    {
        return getClass ().hashCode () ^ (31 * operand0.hashCode () + operand1.hashCode ());
    }
}

/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.operator;

import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.OperatorCalculus;
import gov.sandia.symcalc.language.Renderer;
import gov.sandia.symcalc.language.UnresolvedException;

/**
    Deferred derivative d/dx(operand).
**/
public class Derivative extends OperatorCalculus
{
    public Derivative (Operator operand, String variable)
    {
        super (operand, variable);
    }

    public Operator force (Operator inner) throws UnresolvedException
    {
        return inner.derivative (variable);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append ("d/d" + variable + "(");
        operand.render (renderer);
        renderer.result.append (")");
    }

    public String label ()
    {
        return "DIFF w.r.t. " + variable;
    }

    public String toString ()
    {
        return "d/d" + variable;
    }
}

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
    Deferred indefinite integral of operand with respect to variable. No constant of integration is added.
**/
public class Integral extends OperatorCalculus
{
    public Integral (Operator operand, String variable)
    {
        super (operand, variable);
    }

    public Operator force (Operator inner) throws UnresolvedException
    {
        return inner.integral (variable);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append ("∫ ");
        operand.render (renderer);
        renderer.result.append (" d" + variable);
    }

    public String label ()
    {
        return "INTEGRAL w.r.t. " + variable;
    }

    public String toString ()
    {
        return "∫";
    }
}

/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import static gov.sandia.symcalc.language.Operator.*;
import static org.junit.Assert.*;

import gov.sandia.symcalc.language.type.Rational;

import org.junit.Test;

public class EvaluationTest
{
    Operator x = symbol ("x");
    Operator y = symbol ("y");

    /**
        (3/2)y + log(y)
    **/
    Operator g = add (multiply (number ("3/2"), y), function ("log", y));

    @Test
    public void testSubstitute ()
    {
        Operator s = g.substitute ("y", "4");
        assertEquals ("((3/2 * 4) + log(4))", s.render ());
        assertEquals ("(6 + log(4))", s.simplify ().render ());
        assertEquals (6 + Math.log (4), s.eval (), 1e-12);
        assertEquals (7.386294, s.simplify ().eval (), 1e-6);

        // Original is unchanged.
        assertEquals ("((3/2 * y) + log(y))", g.render ());

        assertEquals ("((3/2 * y) + log(y))", g.substitute ("x", "4").render ());
        assertEquals ("((3/2 * -1/3) + log(-1/3))", g.substitute ("y", "-2/6").render ());
    }

    @Test
    public void testSubstituteInsideDeferred ()
    {
        Operator d = derivative (power (x, number ("2")), "x");
        assertEquals ("d/dx((3 ^ 2))", d.substitute ("x", "3").render ());
        assertEquals ("d/dx((x ^ 2))", d.render ());
        assertEquals ("∫ (3 * 5) dx",  integral (multiply (x, number ("5")), "x").substitute ("x", "3").render ());

        Operator e = derivative (multiply (x, y), "y");
        assertEquals ("d/dy((2 * y))", e.substitute ("x", "2").render ());
        assertEquals ("2", e.substitute ("x", "2").simplify ().render ());
    }

    @Test(expected=NumberFormatException.class)
    public void testSubstituteMalformed ()
    {
        g.substitute ("y", "four");
    }

    @Test
    public void testEval ()
    {
        assertEquals (1.0 / 3,          number ("1/3").eval (), 1e-15);
        assertEquals (Math.sqrt (2),    power (number ("2"), number ("1/2")).eval (), 1e-15);
        assertEquals (Math.exp (1) - 1, add (function ("exp", number ("1")), number ("-1")).eval (), 1e-15);
        assertEquals (0,                function ("sin", number ("0")).eval (), 0);
        assertEquals (-1,               function ("cos", number ("355/113")).eval (), 1e-9);
        assertTrue (Double.isInfinite (function ("log", number ("0")).eval ()));
    }

    @Test(expected=EvaluationException.class)
    public void testEvalFreeSymbol ()
    {
        g.eval ();
    }

    @Test(expected=EvaluationException.class)
    public void testEvalDeferred ()
    {
        integral (number ("1"), "x").eval ();
    }

    @Test
    public void testPartialEvaluation ()
    {
        Operator r = g.evaluate ("y", new Rational (4));
        assertTrue (r.isScalar ());
        assertEquals (6 + Math.log (4), r.getRational ().doubleValue (), 1e-12);

        assertEquals ("(x + 2)", add (x, multiply (y, number ("2"))).evaluate ("y", Rational.ONE).render ());
        assertEquals ("(3 ^ 2)", power (y, number ("2")).evaluate ("y", new Rational (3)).render ());
        assertEquals ("log(0)",  function ("log", y).evaluate ("y", Rational.ZERO).render ());
        assertEquals ("d/dy(y)", derivative (y, "y").evaluate ("y", Rational.ONE).render ());
    }
}

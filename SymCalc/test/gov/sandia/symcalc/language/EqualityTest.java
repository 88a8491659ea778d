/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import static gov.sandia.symcalc.language.Operator.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class EqualityTest
{
    @Test
    public void testStructural ()
    {
        Operator x = symbol ("x");
        Operator y = symbol ("y");

        assertTrue  (equal (x, x));
        assertTrue  (equal (x, symbol (new String ("x"))));
        assertFalse (equal (x, y));
        assertTrue  (equal (number ("2/4"), number ("1/2")));
        assertFalse (equal (number ("1"), x));
        assertFalse (equal (x, null));

        assertTrue  (equal (add (x, y), add (symbol ("x"), symbol ("y"))));
        assertFalse (equal (add (x, y), add (y, x)));  // no commutativity
        assertFalse (equal (add (x, y), multiply (x, y)));

        assertTrue  (equal (function ("sin", x), function ("sin", symbol ("x"))));
        assertFalse (equal (function ("sin", x), function ("cos", x)));

        assertTrue  (equal (derivative (x, "x"), derivative (x, "x")));
        assertFalse (equal (derivative (x, "x"), derivative (x, "y")));
        assertFalse (equal (derivative (x, "x"), integral   (x, "x")));
    }

    @Test
    public void testDeepCopy ()
    {
        Operator e = add (multiply (number ("2"), symbol ("x")), function ("exp", symbol ("x")));
        Operator c = e.deepCopy ();
        assertNotSame (e, c);
        assertTrue (equal (e, c));
        assertEquals (e.hashCode (), c.hashCode ());

        c.transform (new Transformer ()
        {
            public Operator transform (Operator op)
            {
                if (op instanceof Symbol) return symbol ("z");
                return null;
            }
        });
        assertEquals ("((2 * z) + exp(z))", c.render ());
        assertEquals ("((2 * x) + exp(x))", e.render ());
    }

    @Test(expected=Error.class)
    public void testUnknownFunction ()
    {
        function ("tan", symbol ("x"));
    }

    @Test(expected=IllegalArgumentException.class)
    public void testEmptySymbol ()
    {
        symbol ("");
    }
}

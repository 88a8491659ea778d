/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.arena;

import static org.junit.Assert.*;

import gov.sandia.symcalc.language.EvaluationException;
import gov.sandia.symcalc.language.UnresolvedException;

import org.junit.Before;
import org.junit.Test;

public class KernelTest
{
    Kernel k;
    int    x;

    @Before
    public void setUp ()
    {
        k = new Kernel (64);
        x = k.symbol ("x");
    }

    /**
        f = x^3 + sin(x)
    **/
    public int f ()
    {
        return k.add (k.power (x, k.number ("3")), k.function ("sin", x));
    }

    @Test
    public void testRoundTrip () throws UnresolvedException
    {
        int Sf = k.simplify (f ());
        assertEquals ("((x ^ 3) + sin(x))", k.toInfixString (Sf));

        int dSf = k.simplify (k.differentiate (Sf, "x"));
        assertEquals ("((3 * (x ^ 2)) + cos(x))", k.toInfixString (dSf));

        int back = k.simplify (k.integrate (dSf, "x"));
        assertTrue (k.equal (Sf, back));
    }

    @Test
    public void testSubstituteAndEvaluate ()
    {
        int y = k.symbol ("y");
        int g = k.add (k.multiply (k.number ("3/2"), y), k.function ("log", y));
        int s = k.simplify (k.substitute (g, "y", "4"));
        assertEquals ("(6 + log(4))", k.toInfixString (s));
        assertEquals (7.386294, k.evalNumeric (s), 1e-6);

        int p = k.evaluate (g, "y", "4");
        assertEquals (6 + Math.log (4), k.evalNumeric (p), 1e-12);

        assertEquals ("((3/2 * y) + log(y))", k.toInfixString (g));
    }

    @Test
    public void testUnresolvedIntegral ()
    {
        int h = k.multiply (x, k.function ("sin", x));
        int used = k.arena.size ();
        try
        {
            k.integrate (h, "x");
            fail ();
        }
        catch (UnresolvedException e)
        {
            assertEquals ("(x * sin(x))", e.expression);
        }
        assertEquals (used, k.arena.size ());

        int deferred = k.simplify (k.integral (h, "x"));
        assertEquals ("∫ (x * sin(x)) dx", k.toInfixString (deferred));
    }

    @Test
    public void testNested () throws UnresolvedException
    {
        int h = k.multiply (k.function ("sin", x), k.function ("exp", k.power (x, k.number ("2"))));
        assertEquals ("((cos(x) * exp((x ^ 2))) + (sin(x) * (exp((x ^ 2)) * (2 * x))))", k.toInfixString (k.simplify (k.differentiate (h, "x"))));
        assertEquals ("∫ (sin(x) * exp((x ^ 2))) dx", k.toInfixString (k.simplify (k.integral (h, "x"))));
    }

    @Test
    public void testCoefficientExamples ()
    {
        int c = k.number ("-7/20");
        int five = k.number ("5");
        assertEquals ("(-7/4 + (5 * x))", k.toInfixString (k.simplify (k.multiply (k.add (x, c), five))));
        assertEquals ("(-7/4 * x)",       k.toInfixString (k.simplify (k.multiply (k.multiply (x, c), five))));
        assertEquals ("53/4",             k.toInfixString (k.simplify (k.multiply (k.add (k.number ("3"), c), five))));
    }

    @Test
    public void testDerivedConstructors ()
    {
        int y = k.symbol ("y");
        assertEquals ("(-1 * x)",       k.toInfixString (k.negate (x)));
        assertEquals ("2",              k.toInfixString (k.subtract (k.number ("5"), k.number ("3"))));
        assertEquals ("(x * (y ^ -1))", k.toInfixString (k.divide (x, y)));
        assertEquals ("1",              k.toInfixString (k.divide (y, y)));
    }

    @Test
    public void testSharingAndFree ()
    {
        int s = k.function ("sin", x);
        int e = k.add (s, s);
        k.free (s);
        k.free (x);
        assertEquals ("(sin(x) + sin(x))", k.toInfixString (e));

        int c = k.copy (e);
        assertTrue (k.equal (e, c));
        assertNotSame (k.get (e), k.get (c));
    }

    @Test
    public void testTreeDump ()
    {
        assertEquals ("ADD\n    ├── POW\n        ├── SYMBOL: x\n        └── NUMBER: 3\n    └── FUNC: sin\n        └── SYMBOL: x\n", k.toTreeDump (f ()));
    }

    @Test
    public void testLeak ()
    {
        Kernel small = new Kernel (3);
        int a = small.number ("1");
        int b = small.number ("2");
        small.add (a, b);
        try
        {
            small.number ("3");
            fail ();
        }
        catch (Error e)
        {
        }
        small.free (b);
        small.number ("3");
    }

    @Test(expected=Error.class)
    public void testFreedHandle ()
    {
        k.free (x);
        k.toInfixString (x);
    }

    @Test(expected=Error.class)
    public void testEqualFreedHandle ()
    {
        k.free (x);
        k.equal (x, x);
    }

    @Test(expected=Error.class)
    public void testUnknownFunction ()
    {
        k.function ("sinh", x);
    }

    @Test(expected=NumberFormatException.class)
    public void testMalformedNumber ()
    {
        k.number ("1/");
    }

    @Test(expected=ArithmeticException.class)
    public void testDivideByZero ()
    {
        k.divide (k.number ("1"), k.number ("0"));
    }

    @Test(expected=EvaluationException.class)
    public void testEvalFreeSymbol ()
    {
        k.evalNumeric (f ());
    }
}

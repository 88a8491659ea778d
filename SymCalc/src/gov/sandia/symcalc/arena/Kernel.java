/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.arena;

import gov.sandia.symcalc.language.EvaluationException;
import gov.sandia.symcalc.language.Operator;
import gov.sandia.symcalc.language.UnresolvedException;
import gov.sandia.symcalc.language.type.Rational;

import org.apache.log4j.Logger;

/**
    Handle-based front end to the expression language, for drivers that prefer integer
    handles over object references.

    <p>Every method that produces an expression stores it in a new arena slot and returns the
    handle. Intermediate nodes built inside simplify(), differentiate() or integrate() are not
    given slots. Only the final result is. Nothing is released implicitly: each returned handle
    occupies its slot until free() is called or the arena is cleared, and creating more live
    results than the capacity allows is fatal.

    <p>Because nodes are never modified after construction, a handle may be used as a child of
    any number of parents, and freeing it does not disturb expressions already built from it.
**/
public class Kernel
{
    public ExpressionArena arena;

    private static Logger logger = Logger.getLogger (Kernel.class);

    public Kernel ()
    {
        this (ExpressionArena.DEFAULT_CAPACITY);
    }

    public Kernel (int capacity)
    {
        arena = new ExpressionArena (capacity);
    }

    public Operator get (int handle)
    {
        return arena.get (handle);
    }

    public int put (Operator op)
    {
        return arena.alloc (op);
    }

    public void free (int handle)
    {
        arena.free (handle);
    }

    public int copy (int handle)
    {
        return put (get (handle).deepCopy ());
    }

    // Constructors ----------------------------------------------------------

    /**
        @param literal Signed integer or "numerator/denominator".
        @throws NumberFormatException if the literal is malformed.
    **/
    public int number (String literal)
    {
        return put (Operator.number (literal));
    }

    public int symbol (String name)
    {
        return put (Operator.symbol (name));
    }

    public int add (int a, int b)
    {
        return put (Operator.add (get (a), get (b)));
    }

    public int multiply (int a, int b)
    {
        return put (Operator.multiply (get (a), get (b)));
    }

    public int power (int base, int exponent)
    {
        return put (Operator.power (get (base), get (exponent)));
    }

    /**
        @param name One of sin, cos, exp, log.
    **/
    public int function (String name, int argument)
    {
        return put (Operator.function (name, get (argument)));
    }

    public int derivative (int inner, String variable)
    {
        return put (Operator.derivative (get (inner), variable));
    }

    public int integral (int inner, String variable)
    {
        return put (Operator.integral (get (inner), variable));
    }

    public int negate (int a)
    {
        return put (Operator.negate (get (a)));
    }

    public int subtract (int a, int b)
    {
        return put (Operator.subtract (get (a), get (b)));
    }

    public int divide (int n, int d)
    {
        return put (Operator.divide (get (n), get (d)));
    }

    // Algorithms ------------------------------------------------------------

    public int simplify (int handle)
    {
        return put (get (handle).simplify ());
    }

    /**
        @throws UnresolvedException if no derivative rule covers the expression. No slot is taken in that case.
    **/
    public int differentiate (int handle, String variable) throws UnresolvedException
    {
        try
        {
            return put (get (handle).derivative (variable));
        }
        catch (UnresolvedException e)
        {
            logger.debug ("Couldn't resolve derivative for expression: " + e.expression);
            throw e;
        }
    }

    /**
        @throws UnresolvedException if no integration rule covers the expression. No slot is taken in that case.
    **/
    public int integrate (int handle, String variable) throws UnresolvedException
    {
        try
        {
            return put (get (handle).integral (variable));
        }
        catch (UnresolvedException e)
        {
            logger.debug ("Couldn't resolve integration for expression: " + e.expression);
            throw e;
        }
    }

    public int substitute (int handle, String symbol, String literal)
    {
        return put (get (handle).substitute (symbol, literal));
    }

    public int evaluate (int handle, String symbol, String literal)
    {
        return put (get (handle).evaluate (symbol, Rational.parse (literal)));
    }

    /**
        @throws EvaluationException if the expression contains a free symbol or a deferred operation.
    **/
    public double evalNumeric (int handle) throws EvaluationException
    {
        return get (handle).eval ();
    }

    public boolean equal (int a, int b)
    {
        Operator x = get (a);
        if (a == b) return true;
        return Operator.equal (x, get (b));
    }

    // Printing --------------------------------------------------------------

    public String toInfixString (int handle)
    {
        return get (handle).render ();
    }

    public String toTreeDump (int handle)
    {
        return get (handle).dump ();
    }
}

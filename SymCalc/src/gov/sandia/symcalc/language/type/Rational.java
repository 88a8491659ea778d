/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
    Exact fraction of arbitrary precision.
    Always held in lowest terms with a positive denominator, so two equal values
    have identical numerator and denominator.
**/
public class Rational
{
    public final BigInteger numerator;
    public final BigInteger denominator;  // always positive

    public static final Rational ZERO      = new Rational (0);
    public static final Rational ONE       = new Rational (1);
    public static final Rational MINUS_ONE = new Rational (-1);
    public static final Rational TWO       = new Rational (2);
    public static final Rational HALF      = new Rational (1, 2);

    protected static final Pattern literal = Pattern.compile ("([+-]?\\d+)(?:/([+-]?\\d+))?");

    public Rational (long value)
    {
        numerator   = BigInteger.valueOf (value);
        denominator = BigInteger.ONE;
    }

    public Rational (long numerator, long denominator)
    {
        this (BigInteger.valueOf (numerator), BigInteger.valueOf (denominator));
    }

    public Rational (BigInteger numerator, BigInteger denominator)
    {
        if (denominator.signum () == 0) throw new ArithmeticException ("Zero denominator: " + numerator + "/" + denominator);
        if (denominator.signum () < 0)
        {
            numerator   = numerator  .negate ();
            denominator = denominator.negate ();
        }
        BigInteger gcd = numerator.gcd (denominator);
        if (! gcd.equals (BigInteger.ONE))  // gcd(0,d) == d, which reduces zero to 0/1
        {
            numerator   = numerator  .divide (gcd);
            denominator = denominator.divide (gcd);
        }
        this.numerator   = numerator;
        this.denominator = denominator;
    }

    /**
        Parses a literal of the form "n" or "n/d", where each part is a decimal integer
        with optional sign. The result is reduced immediately.
        @throws NumberFormatException if the literal is malformed or has a zero denominator.
    **/
    public static Rational parse (String value)
    {
        if (value == null) throw new NumberFormatException ("Invalid rational string: null");
        Matcher m = literal.matcher (value);
        if (! m.matches ()) throw new NumberFormatException ("Invalid rational string: " + value);
        BigInteger n = new BigInteger (m.group (1));
        BigInteger d = BigInteger.ONE;
        if (m.group (2) != null) d = new BigInteger (m.group (2));
        if (d.signum () == 0) throw new NumberFormatException ("Invalid rational string: " + value + " (zero denominator)");
        return new Rational (n, d);
    }

    /**
        Converts a finite double to the rational it represents exactly.
        Note that most decimal fractions do not have an exact binary form, so 0.1 produces
        a large denominator.
    **/
    public static Rational valueOf (double value)
    {
        if (Double.isNaN (value)  ||  Double.isInfinite (value)) throw new NumberFormatException ("Not a finite value: " + value);
        BigDecimal exact = new BigDecimal (value);
        int scale = exact.scale ();
        if (scale > 0) return new Rational (exact.unscaledValue (), BigInteger.TEN.pow (scale));
        return new Rational (exact.unscaledValue ().multiply (BigInteger.TEN.pow (-scale)), BigInteger.ONE);
    }

    public Rational add (Rational that)
    {
        BigInteger n = numerator.multiply (that.denominator).add (that.numerator.multiply (denominator));
        return new Rational (n, denominator.multiply (that.denominator));
    }

    public Rational subtract (Rational that)
    {
        return add (that.negate ());
    }

    public Rational multiply (Rational that)
    {
        return new Rational (numerator.multiply (that.numerator), denominator.multiply (that.denominator));
    }

    /**
        @throws ArithmeticException if that is zero.
    **/
    public Rational divide (Rational that)
    {
        if (that.isZero ()) throw new ArithmeticException ("Division by zero: " + this + " / 0");
        return new Rational (numerator.multiply (that.denominator), denominator.multiply (that.numerator));
    }

    public Rational negate ()
    {
        return new Rational (numerator.negate (), denominator);
    }

    public int signum ()
    {
        return numerator.signum ();
    }

    public boolean isZero ()
    {
        return signum () == 0;
    }

    public boolean isOne ()
    {
        return numerator.equals (BigInteger.ONE)  &&  denominator.equals (BigInteger.ONE);
    }

    public boolean isInteger ()
    {
        return denominator.equals (BigInteger.ONE);
    }

    public double doubleValue ()
    {
        if (isInteger ()) return numerator.doubleValue ();
        return new BigDecimal (numerator).divide (new BigDecimal (denominator), MathContext.DECIMAL128).doubleValue ();
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Rational)) return false;
        Rational r = (Rational) that;
        return numerator.equals (r.numerator)  &&  denominator.equals (r.denominator);
    }

    public int hashCode ()
    {
        return 31 * numerator.hashCode () + denominator.hashCode ();
    }

    /**
        Same form as the accepted literal: "n" for integers, otherwise "n/d" with the sign on n.
    **/
    public String toString ()
    {
        if (isInteger ()) return numerator.toString ();
        return numerator + "/" + denominator;
    }
}

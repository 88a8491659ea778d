/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

import gov.sandia.symcalc.language.function.Cosine;
import gov.sandia.symcalc.language.function.Exp;
import gov.sandia.symcalc.language.function.Log;
import gov.sandia.symcalc.language.function.Sine;
import gov.sandia.symcalc.language.operator.Add;
import gov.sandia.symcalc.language.operator.Derivative;
import gov.sandia.symcalc.language.operator.Integral;
import gov.sandia.symcalc.language.operator.Multiply;
import gov.sandia.symcalc.language.operator.Power;
import gov.sandia.symcalc.language.type.Rational;

import java.util.TreeMap;

/**
    Base class of the expression tree.

    <p>Nodes are built once and then treated as values. simplify(), derivative(), integral() and
    evaluate() never modify the tree they are called on. They return new nodes, which may share
    unchanged subtrees with the input. Only transform() works in place, and substitute() applies it
    to a deep copy.

    <p>All the recursive algorithms descend once per level of the tree, so the deepest expression
    that can be processed is bounded by the thread stack. With default JVM settings that is
    several thousand levels.
**/
public class Operator implements Cloneable
{
    public interface Factory
    {
        public String   name ();  ///< Unique string for searching in the table of registered functions.
        public Operator createInstance ();
    }

    public Operator deepCopy ()
    {
        try
        {
            return (Operator) this.clone ();
        }
        catch (CloneNotSupportedException e)
        {
            throw new Error ("Operator must be cloneable", e);
        }
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        return this;
    }

    /**
        Bottom-up canonicalizing rewrite. Folds numeric subtrees exactly, removes identities,
        moves numeric coefficients to the left operand, merges like terms and powers, and forces
        any deferred derivative or integral. Deterministic, and idempotent on its own output.
    **/
    public Operator simplify ()
    {
        return this;
    }

    /**
        Syntax-directed derivative with respect to the named variable. The result is not simplified.
        @throws UnresolvedException if no rule covers this shape.
    **/
    public Operator derivative (String variable) throws UnresolvedException
    {
        throw new UnresolvedException (this, "No differentiation rule for " + label ());
    }

    /**
        Syntax-directed antiderivative with respect to the named variable. The result is not simplified.
        The rules are narrower than those of derivative().
        @throws UnresolvedException if no rule covers this shape.
    **/
    public Operator integral (String variable) throws UnresolvedException
    {
        throw new UnresolvedException (this, "No integration rule for " + label ());
    }

    /**
        Numeric value of a symbol-free tree.
        @throws EvaluationException if the tree contains a free symbol or a deferred node.
    **/
    public double eval () throws EvaluationException
    {
        throw new EvaluationException ("Operator not implemented: " + label ());
    }

    /**
        Partial evaluation: replaces the named symbol by a value, then folds sums and products of
        two numbers and functions of a number on the way back up. Powers stay symbolic.
        Function values are inexact, being the rational form of a double.
    **/
    public Operator evaluate (String name, Rational value)
    {
        return this;
    }

    /**
        Replaces every occurrence of the named symbol by a numeric literal, including occurrences
        inside a deferred derivative or integral. No folding is done.
    **/
    public Operator substitute (final String name, final Rational value)
    {
        return deepCopy ().transform (new Transformer ()
        {
            public Operator transform (Operator op)
            {
                if (op instanceof Symbol  &&  ((Symbol) op).name.equals (name)) return new Constant (value);
                return null;
            }
        });
    }

    /**
        @param literal "n" or "n/d", as accepted by Rational.parse()
        @throws NumberFormatException if the literal is malformed.
    **/
    public Operator substitute (String name, String literal)
    {
        return substitute (name, Rational.parse (literal));
    }

    public String render ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (toString ());
    }

    /**
        Indented tree view, one line per node, with branches drawn as "├── " and "└── ".
    **/
    public String dump ()
    {
        StringBuilder result = new StringBuilder ();
        dump (result, 0, "");
        return result.toString ();
    }

    public void dump (StringBuilder result, int indent, String prefix)
    {
        for (int i = 0; i < indent; i++) result.append (' ');
        result.append (prefix);
        result.append (label ());
        result.append ('\n');
    }

    /**
        Caption of this node in dump().
    **/
    public String label ()
    {
        return "unknown";
    }

    /**
        Determines if this is a numeric constant.
    **/
    public boolean isScalar ()
    {
        return false;
    }

    /**
        Extracts the value of a numeric constant.
        If this is not a constant, then return null.
    **/
    public Rational getRational ()
    {
        return null;
    }

    /**
        Determines if this is a numeric constant with exactly the given value.
    **/
    public boolean isScalar (Rational value)
    {
        return isScalar ()  &&  getRational ().equals (value);
    }

    public String toString ()
    {
        return "unknown";
    }


    // Static interface ------------------------------------------------------

    public static TreeMap<String,Factory> functions = new TreeMap<String,Factory> ();

    public static void register (Factory f)
    {
        functions.put (f.name (), f);
    }

    static
    {
        register (Cosine.factory ());
        register (Exp   .factory ());
        register (Log   .factory ());
        register (Sine  .factory ());
    }

    /**
        Structural equality. Identical references are equal without further inspection.
        Otherwise the node classes, payloads and children must all match. There is no notion
        of commutativity here, so x+y and y+x differ unless simplify() has ordered both the same way.
    **/
    public static boolean equal (Operator a, Operator b)
    {
        if (a == b) return true;
        if (a == null  ||  b == null) return false;
        return a.equals (b);
    }

    /**
        @param literal Signed integer or "numerator/denominator". Reduced to lowest terms immediately.
        @throws NumberFormatException if the literal is malformed.
    **/
    public static Constant number (String literal)
    {
        return new Constant (Rational.parse (literal));
    }

    public static Symbol symbol (String name)
    {
        return new Symbol (name);
    }

    public static Add add (Operator a, Operator b)
    {
        return new Add (a, b);
    }

    public static Multiply multiply (Operator a, Operator b)
    {
        return new Multiply (a, b);
    }

    public static Power power (Operator base, Operator exponent)
    {
        return new Power (base, exponent);
    }

    /**
        @param name One of the registered functions: sin, cos, exp or log.
        @throws Error if no function is registered under the given name.
    **/
    public static Function function (String name, Operator argument)
    {
        Factory f = functions.get (name);
        if (f == null) throw new Error ("Unknown function type: " + name);
        Function result = (Function) f.createInstance ();
        result.operands[0] = argument;
        return result;
    }

    public static Derivative derivative (Operator inner, String variable)
    {
        return new Derivative (inner, variable);
    }

    public static Integral integral (Operator inner, String variable)
    {
        return new Integral (inner, variable);
    }

    /**
        -a, expressed as (-1)*a. Not simplified.
    **/
    public static Multiply negate (Operator a)
    {
        return new Multiply (new Constant (Rational.MINUS_ONE), a);
    }

    /**
        a-b, expressed as a+(-1)*b and then simplified.
    **/
    public static Operator subtract (Operator a, Operator b)
    {
        return new Add (a, negate (b)).simplify ();
    }

    /**
        n/d with the shortcuts n/1 → n, 0/d → 0, a/a → 1 and exact division of two numbers.
        Anything else becomes n*d^-1, simplified.
        @throws ArithmeticException if d is the number zero and n is a nonzero number.
    **/
    public static Operator divide (Operator n, Operator d)
    {
        if (d.isScalar (Rational.ONE )) return n;
        if (n.isScalar (Rational.ZERO)) return new Constant (Rational.ZERO);
        if (equal (n, d))               return new Constant (Rational.ONE);
        if (n.isScalar ()  &&  d.isScalar ()) return new Constant (n.getRational ().divide (d.getRational ()));
        return new Multiply (n, new Power (d, new Constant (Rational.MINUS_ONE))).simplify ();
    }
}

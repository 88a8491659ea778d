/*
Copyright 2022-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language;

/**
    Single naming scheme shared by symbols and by the bound variable of derivatives and integrals.
    Names are opaque, so the only canonical step is interning.
**/
public class Identifier
{
    public static String canonical (String name)
    {
        if (name == null  ||  name.isEmpty ()) throw new IllegalArgumentException ("Identifier must be a non-empty string");
        return name.intern ();
    }
}

/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.arena;

import gov.sandia.symcalc.language.Operator;

import org.apache.log4j.Logger;

/**
    Fixed-capacity pool of expression slots addressed by integer handle.

    <p>Released slots go on a free list and are handed out again by later allocations.
    There is no generation count, so a handle kept past its release may silently refer to
    whatever occupies the slot next. Callers must drop a handle once they free it.

    <p>Nothing is released implicitly. Every allocation holds its slot until free() or clear(),
    so long-running callers must reclaim results they no longer need.

    <p>Not thread-safe. Use one arena per thread, or serialize access externally.
**/
public class ExpressionArena
{
    public static final int DEFAULT_CAPACITY = 65536;

    protected Operator[] slots;
    protected boolean[]  used;
    protected int[]      freeList;  // stack of available slot indices, next one on top
    protected int        freeCount;

    private static Logger logger = Logger.getLogger (ExpressionArena.class);

    public ExpressionArena ()
    {
        this (DEFAULT_CAPACITY);
    }

    public ExpressionArena (int capacity)
    {
        if (capacity <= 0) throw new IllegalArgumentException ("Arena capacity must be positive: " + capacity);
        slots    = new Operator[capacity];
        used     = new boolean [capacity];
        freeList = new int     [capacity];
        clear ();
    }

    /**
        Takes a free slot and stores the node there.
        @throws Error if every slot is occupied.
    **/
    public int alloc (Operator node)
    {
        if (node == null) throw new IllegalArgumentException ("Cannot store a null expression");
        if (freeCount == 0)
        {
            logger.error ("Expression arena exhausted, capacity " + slots.length);
            throw new Error ("Expression arena exhausted (capacity " + slots.length + ")");
        }
        int handle = freeList[--freeCount];
        slots[handle] = node;
        used [handle] = true;
        return handle;
    }

    /**
        Disposes the node in the given slot and returns the slot to the free list.
        Freeing a slot twice, or a handle that was never allocated, does nothing.
    **/
    public void free (int handle)
    {
        if (! isValid (handle)) return;
        slots[handle] = null;
        used [handle] = false;
        freeList[freeCount++] = handle;
    }

    /**
        @throws Error if the handle is out of range or its slot is not in use.
    **/
    public Operator get (int handle)
    {
        if (! isValid (handle))
        {
            logger.error ("Invalid expression handle " + handle);
            throw new Error ("Invalid expression handle: " + handle);
        }
        return slots[handle];
    }

    public boolean isValid (int handle)
    {
        return handle >= 0  &&  handle < slots.length  &&  used[handle];
    }

    /**
        Releases every slot at once.
    **/
    public void clear ()
    {
        int capacity = slots.length;
        for (int i = 0; i < capacity; i++)
        {
            slots[i] = null;
            used [i] = false;
            freeList[i] = capacity - 1 - i;  // lowest index on top
        }
        freeCount = capacity;
    }

    public int size ()
    {
        return slots.length - freeCount;
    }

    public int capacity ()
    {
        return slots.length;
    }
}

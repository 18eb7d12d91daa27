package com.cliffc.spdx.lattice;

import com.cliffc.spdx.SPDX;
import com.cliffc.spdx.util.Ary;
import com.cliffc.spdx.util.SB;

/** Brute-force evaluation of lattice formulas.
 */

// Instead of normalizing, guess every variable both ways and evaluate.  The search is
// depth-first and in continuation-passing style: a node evaluates under the
// current path assignment and hands (path,value) to its continuation.  A
// variable not yet on the path calls the continuation twice, once per guess,
// each with its own extended path.
//
// Joins and meets short-circuit per path.  This is not just speed: a variable
// that cannot change the outcome on some path is never guessed on that path,
// so the search tree holds only the variables that matter.
//
// Exponential in the number of distinct variables forced open on a path.
// License expressions rarely carry more than a handful.

public abstract class Eval {
  // Continuation: receives the path so far and the value computed on it.
  // Returns true to stop the whole search.
  interface K<T> { boolean run( Asgn<T> asgn, boolean b ); }

  // One complete search path and the value(s) computed on it
  public static final class Outcome<T> {
    public final Asgn<T> _asgn;
    public final boolean _a, _b; // Values of the 1st & 2nd formula; same if only one
    final boolean _pair;
    Outcome( Asgn<T> asgn, boolean a, boolean b, boolean pair ) { _asgn=asgn; _a=a; _b=b; _pair=pair; }
    @Override public String toString() {
      SB sb = new SB().p(_asgn.toString()).p(" -> ");
      return (_pair ? sb.p('(').p(_a?'T':'F').p(',').p(_b?'T':'F').p(')') : sb.p(_a?'T':'F')).toString();
    }
  }

  // All complete paths for one formula, depth-first, true-guess first
  public static <T> Ary<Outcome<T>> outcomes( Lattice<T> a ) {
    Ary<Outcome<T>> outs = new Ary<>();
    a.eval(Asgn.empty(), (asgn,x) -> { outs.add(new Outcome<>(asgn,x,x,false)); return false; });
    return outs;
  }

  // All complete paths for two formulas sharing one assignment per path.  'b'
  // is evaluated under each of 'a's paths, so a variable in both gets one value.
  public static <T> Ary<Outcome<T>> outcomes( Lattice<T> a, Lattice<T> b ) {
    Ary<Outcome<T>> outs = new Ary<>();
    a.eval(Asgn.empty(), (asgn,x) -> b.eval(asgn, (asgn2,y) -> { outs.add(new Outcome<>(asgn2,x,y,true)); return false; }));
    return outs;
  }

  // True if 'a' and 'b' agree under every assignment.  Proving it walks every
  // path; the first path where they differ ends the search.
  public static <T> boolean equivalent( Lattice<T> a, Lattice<T> b ) {
    boolean differ = a.eval(Asgn.empty(), (asgn,x) -> b.eval(asgn, (asgn2,y) -> x!=y && counter(a,b,asgn2,x,y)));
    return !differ;
  }
  private static <T> boolean counter( Lattice<T> a, Lattice<T> b, Asgn<T> asgn, boolean x, boolean y ) {
    SPDX.p(asgn,"Not equivalent: "+a+" is "+x+" but "+b+" is "+y+" under "+asgn);
    return true;
  }

  // a <= b  iff  a \/ b == b.  Kept in terms of equivalent() so the two
  // predicates can never disagree.
  public static <T> boolean preorder( Lattice<T> a, Lattice<T> b ) {
    return equivalent(a.join(b),b);
  }

  // True if some assignment makes 'a' true; stops at the first one.
  public static <T> boolean satisfiable( Lattice<T> a ) {
    return a.eval(Asgn.empty(), (asgn,x) -> x);
  }
}

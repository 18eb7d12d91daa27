package com.cliffc.spdx.lattice;

import com.cliffc.spdx.util.Ary;
import com.cliffc.spdx.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.function.Function;

/** Syntax of a free distributive lattice over terms 'T'.
 */

// A lattice formula is a small immutable tree: variables, the two bounds, and
// binary join & meet.  Join is the least-upper-bound (boolean OR) and Meet is
// the greatest-lower-bound (boolean AND).  TOP is true and BOT is false.
//
// Formulas are not normalized; "X /\ X" and "X" are different trees.  Semantic
// questions (equivalence, ordering) are answered by brute-force evaluation,
// see Eval.  The only thing ever asked of a term is equals().
//
// Lattice ordering:  a <= b  iff  a \/ b == b  iff  a == a /\ b
//
//       TOP
//        |
//      X \/ Y
//      /    \
//     X      Y
//      \    /
//      X /\ Y
//        |
//       BOT

public abstract class Lattice<T> {
  Lattice() { }

  // ----------
  // Factories
  public static <T> @NotNull LVar<T> var( T v ) { return new LVar<>(v); }
  @SuppressWarnings("unchecked")
  public static <T> @NotNull Lattice<T> bound( boolean b ) { return b ? LBound.TOP : LBound.BOT; }
  public static <T> @NotNull Lattice<T> top() { return bound(true ); }
  public static <T> @NotNull Lattice<T> bot() { return bound(false); }
  public @NotNull Lattice<T> join( Lattice<T> t ) { return new LJoin<>(this,t); }
  public @NotNull Lattice<T> meet( Lattice<T> t ) { return new LMeet<>(this,t); }

  // Left-fold join over a list; the empty join is BOT
  public static <T> @NotNull Lattice<T> joins( Ary<Lattice<T>> ls ) {
    if( ls.isEmpty() ) return bot();
    Lattice<T> l = ls.at(0);
    for( int i=1; i<ls._len; i++ ) l = l.join(ls.at(i));
    return l;
  }
  // Left-fold meet over a list; the empty meet is TOP
  public static <T> @NotNull Lattice<T> meets( Ary<Lattice<T>> ls ) {
    if( ls.isEmpty() ) return top();
    Lattice<T> l = ls.at(0);
    for( int i=1; i<ls._len; i++ ) l = l.meet(ls.at(i));
    return l;
  }

  // ----------
  // De Morgan dual: swap join & meet, flip the bounds, variables unchanged.
  public abstract @NotNull Lattice<T> dual();

  // Every variable, left to right, including duplicates.  Callers wanting a
  // set must dedup.
  public final @NotNull Ary<T> freeVars() { return vars(new Ary<>()); }
  abstract Ary<T> vars( Ary<T> vs );

  // Replace every variable 'v' with the formula 'f(v)'; bounds, joins and
  // meets keep their shape.  Example:
  //     (X /\ Y).subst( v -> v==X ? (X1 \/ X2) : var(v) )
  //     ((X1 \/ X2) /\ Y)
  public abstract <U> @NotNull Lattice<U> subst( Function<? super T, Lattice<U>> f );

  // Rename every variable
  public final <U> @NotNull Lattice<U> map( Function<? super T, ? extends U> f ) {
    return subst(v -> var(f.apply(v)));
  }

  // True if 'this' is below 't' in the lattice order; this entails t.
  public final boolean isa( Lattice<T> t ) { return Eval.preorder(this,t); }

  // Evaluate under the path assignment, handing each (path,value) to 'k'.
  // Variables not yet on the path fork the search.  Returns true if 'k' asked
  // to stop.
  abstract boolean eval( Asgn<T> asgn, Eval.K<T> k );

  // ----------
  // Everybody has to have a pretty print
  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }
}

package com.cliffc.spdx.lattice;

import com.cliffc.spdx.util.Ary;
import com.cliffc.spdx.util.SB;

import java.util.function.Function;

// The lattice bounds: TOP is true, BOT is false.  Only the two instances exist.
@SuppressWarnings({"rawtypes","unchecked"})
public final class LBound<T> extends Lattice<T> {
  public final boolean _b;
  private LBound( boolean b ) { _b = b; }
  static final LBound TOP = new LBound(true );
  static final LBound BOT = new LBound(false);

  @Override public Lattice<T> dual() { return _b ? BOT : TOP; }
  @Override Ary<T> vars( Ary<T> vs ) { return vs; }
  @Override public <U> Lattice<U> subst( Function<? super T, Lattice<U>> f ) { return (Lattice<U>)this; }
  @Override boolean eval( Asgn<T> asgn, Eval.K<T> k ) { return k.run(asgn,_b); }

  @Override public SB str( SB sb ) { return sb.p(_b ? "T" : "F"); }
  @Override public boolean equals( Object o ) { return o instanceof LBound<?> b && _b==b._b; }
  @Override public int hashCode() { return _b ? 1 : 2; }
}

package com.cliffc.spdx.lattice;

import com.cliffc.spdx.util.Ary;
import com.cliffc.spdx.util.SB;

import java.util.function.Function;

// A variable; an opaque term
public final class LVar<T> extends Lattice<T> {
  public final T _v;
  LVar( T v ) { assert v!=null; _v = v; }

  @Override public Lattice<T> dual() { return this; }
  @Override Ary<T> vars( Ary<T> vs ) { return vs.add(_v); }
  @Override public <U> Lattice<U> subst( Function<? super T, Lattice<U>> f ) { return f.apply(_v); }

  // Reuse the value guessed earlier on this path, or guess both ways.
  @Override boolean eval( Asgn<T> asgn, Eval.K<T> k ) {
    Boolean b = asgn.get(_v);
    if( b!=null ) return k.run(asgn,b);
    return k.run(asgn.put(_v,true ),true ) ||
           k.run(asgn.put(_v,false),false);
  }

  @Override public SB str( SB sb ) { return sb.pobj(_v); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof LVar<?> v && _v.equals(v._v);
  }
  @Override public int hashCode() { return _v.hashCode(); }
}

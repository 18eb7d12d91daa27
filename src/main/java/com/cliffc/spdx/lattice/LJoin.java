package com.cliffc.spdx.lattice;

import com.cliffc.spdx.util.Ary;
import com.cliffc.spdx.util.SB;

import java.util.function.Function;

// Least-upper-bound; boolean OR
public final class LJoin<T> extends Lattice<T> {
  public final Lattice<T> _l, _r;
  LJoin( Lattice<T> l, Lattice<T> r ) { _l = l; _r = r; }

  @Override public Lattice<T> dual() { return _l.dual().meet(_r.dual()); }
  @Override Ary<T> vars( Ary<T> vs ) { return _r.vars(_l.vars(vs)); }
  @Override public <U> Lattice<U> subst( Function<? super T, Lattice<U>> f ) { return _l.subst(f).join(_r.subst(f)); }

  // Short-circuit: a path where the left side is true never looks at the
  // right side, so never forks on variables only the right side mentions.
  @Override boolean eval( Asgn<T> asgn, Eval.K<T> k ) {
    return _l.eval(asgn, (asgn2,b) -> b ? k.run(asgn2,true) : _r.eval(asgn2,k));
  }

  @Override public SB str( SB sb ) { return _r.str(_l.str(sb.p('(')).p(" \\/ ")).p(')'); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof LJoin<?> j && _l.equals(j._l) && _r.equals(j._r);
  }
  @Override public int hashCode() { return (_l.hashCode()*31+_r.hashCode())*3+1; }
}

package com.cliffc.spdx.lattice;

import com.cliffc.spdx.util.Ary;
import com.cliffc.spdx.util.SB;

import java.util.function.Function;

// Greatest-lower-bound; boolean AND
public final class LMeet<T> extends Lattice<T> {
  public final Lattice<T> _l, _r;
  LMeet( Lattice<T> l, Lattice<T> r ) { _l = l; _r = r; }

  @Override public Lattice<T> dual() { return _l.dual().join(_r.dual()); }
  @Override Ary<T> vars( Ary<T> vs ) { return _r.vars(_l.vars(vs)); }
  @Override public <U> Lattice<U> subst( Function<? super T, Lattice<U>> f ) { return _l.subst(f).meet(_r.subst(f)); }

  // Short-circuit on a false left side
  @Override boolean eval( Asgn<T> asgn, Eval.K<T> k ) {
    return _l.eval(asgn, (asgn2,b) -> b ? _r.eval(asgn2,k) : k.run(asgn2,false));
  }

  @Override public SB str( SB sb ) { return _r.str(_l.str(sb.p('(')).p(" /\\ ")).p(')'); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof LMeet<?> m && _l.equals(m._l) && _r.equals(m._r);
  }
  @Override public int hashCode() { return (_l.hashCode()*31+_r.hashCode())*3+2; }
}

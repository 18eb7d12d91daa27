package com.cliffc.spdx.ast;

import com.cliffc.spdx.Lic;
import com.cliffc.spdx.lattice.Lattice;
import com.cliffc.spdx.lic.Ranges;
import com.cliffc.spdx.util.SB;

// Conjunction; both licenses apply.  Translates to a lattice meet.
public class And extends Expr {
  public final Expr _l, _r;
  public And( Expr l, Expr r ) { _l=l; _r=r; }

  @Override public SB str( SB sb ) { return _r.str(_l.str(sb,prec()).p(" AND "),prec()); }
  @Override int prec() { return 2; }
  @Override public Lattice<Lic> lattice( Ranges.Lookup ranges ) {
    return _l.lattice(ranges).meet(_r.lattice(ranges));
  }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof And a && _l.equals(a._l) && _r.equals(a._r);
  }
  @Override public int hashCode() { return (_l.hashCode()*31+_r.hashCode())*3+2; }
}

package com.cliffc.spdx.ast;

import com.cliffc.spdx.Lic;
import com.cliffc.spdx.lattice.Lattice;
import com.cliffc.spdx.lic.Ranges;
import com.cliffc.spdx.util.SB;

// Disjunction; a choice of licenses.  Translates to a lattice join.
public class Or extends Expr {
  public final Expr _l, _r;
  public Or( Expr l, Expr r ) { _l=l; _r=r; }

  @Override public SB str( SB sb ) { return _r.str(_l.str(sb,prec()).p(" OR "),prec()); }
  @Override int prec() { return 1; }
  @Override public Lattice<Lic> lattice( Ranges.Lookup ranges ) {
    return _l.lattice(ranges).join(_r.lattice(ranges));
  }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Or a && _l.equals(a._l) && _r.equals(a._r);
  }
  @Override public int hashCode() { return (_l.hashCode()*31+_r.hashCode())*3+1; }
}

package com.cliffc.spdx.ast;

import com.cliffc.spdx.Lic;
import com.cliffc.spdx.lattice.Lattice;
import com.cliffc.spdx.lic.LicName;
import com.cliffc.spdx.lic.LicenseExceptionId;
import com.cliffc.spdx.lic.LicenseId;
import com.cliffc.spdx.lic.Ranges;
import com.cliffc.spdx.util.Ary;
import com.cliffc.spdx.util.SB;

import java.util.Objects;

// A simple license expression: a license, an optional "or-later" marker and
// an optional exception.  "GPL-2.0+ WITH Classpath-exception-2.0"
public class Simple extends Expr {
  public final LicName _lic;             // Registered id or free-form ref
  public final boolean _plus;            // "or-later"
  public final LicenseExceptionId _exc;  // Optional, null if none
  public Simple( LicName lic, boolean plus, LicenseExceptionId exc ) { assert lic!=null; _lic=lic; _plus=plus; _exc=exc; }

  @Override public SB str( SB sb ) {
    sb.pobj(_lic);
    if( _plus ) sb.p('+');
    return _exc==null ? sb : sb.p(" WITH ").pobj(_exc);
  }
  @Override int prec() { return 3; }

  // An or-later license becomes a join over its range, every member keeping
  // the exception.  An empty range is the empty join, BOT; no license can
  // satisfy it.  A LicenseRef has no known later versions and stays a
  // single variable; "LicenseRef-x+" and "LicenseRef-x" are the same term.
  @Override public Lattice<Lic> lattice( Ranges.Lookup ranges ) {
    Lattice<Lic> v = Lattice.var(new Lic(_lic,_exc));
    if( !_plus || !_lic.registered() ) return v;
    return v.subst(lic -> expand((LicenseId)lic._lic,lic._exc,ranges));
  }
  private static Lattice<Lic> expand( LicenseId id, LicenseExceptionId exc, Ranges.Lookup ranges ) {
    Ary<LicenseId> ids = ranges.range(id);
    Ary<Lattice<Lic>> vs = ids.<Lattice<Lic>>map(l -> Lattice.var(new Lic(l,exc)));
    return Lattice.joins(vs);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Simple s && _plus==s._plus && _lic.equals(s._lic) && Objects.equals(_exc,s._exc);
  }
  @Override public int hashCode() { return _lic.hashCode()+(_plus?1:0)+Objects.hashCode(_exc); }
}

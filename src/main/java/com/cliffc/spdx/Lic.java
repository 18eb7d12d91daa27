package com.cliffc.spdx;

import com.cliffc.spdx.lic.LicName;
import com.cliffc.spdx.lic.LicenseExceptionId;
import com.cliffc.spdx.util.SB;

import java.util.Objects;

/** A license term: the atomic variable of a license lattice.
 *  A license name and an optional exception; "GPL-2.0" and
 *  "GPL-2.0 WITH Classpath-exception-2.0" are different terms. */
public final class Lic {
  public final LicName _lic;              // Registered id or free-form ref
  public final LicenseExceptionId _exc;   // Optional exception, or null
  public Lic( LicName lic, LicenseExceptionId exc ) { assert lic!=null; _lic=lic; _exc=exc; }

  public SB str( SB sb ) {
    sb.pobj(_lic);
    return _exc==null ? sb : sb.p(" WITH ").pobj(_exc);
  }
  @Override public String toString() { return str(new SB()).toString(); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Lic lic && _lic.equals(lic._lic) && Objects.equals(_exc,lic._exc);
  }
  @Override public int hashCode() { return _lic.hashCode()*31+Objects.hashCode(_exc); }
}

package com.cliffc.spdx.lic;

import com.cliffc.spdx.util.SB;

/** A registered SPDX license identifier, e.g. "MIT" or "GPL-2.0".
 *  Only made by the Licenses table; one instance per identifier. */
public final class LicenseId implements LicName {
  public final String _id;      // Short identifier
  public final String _name;    // Full name
  public final boolean _osi;    // OSI approved
  LicenseId( String id, String name, boolean osi ) { _id=id; _name=name; _osi=osi; }

  @Override public boolean registered() { return true; }
  public SB str( SB sb ) { return sb.p(_id); }
  @Override public String toString() { return _id; }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof LicenseId id && _id.equals(id._id);
  }
  @Override public int hashCode() { return _id.hashCode(); }
}

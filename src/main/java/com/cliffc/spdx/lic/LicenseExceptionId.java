package com.cliffc.spdx.lic;

/** A registered SPDX license exception, e.g. "Classpath-exception-2.0".
 *  Only made by the Exceptions table. */
public final class LicenseExceptionId {
  public final String _id;      // Short identifier
  public final String _name;    // Full name
  LicenseExceptionId( String id, String name ) { _id=id; _name=name; }

  @Override public String toString() { return _id; }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof LicenseExceptionId id && _id.equals(id._id);
  }
  @Override public int hashCode() { return _id.hashCode(); }
}

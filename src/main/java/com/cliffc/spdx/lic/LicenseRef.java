package com.cliffc.spdx.lic;

import com.cliffc.spdx.util.SB;

import java.util.Objects;

/** A free-form license reference:
 *    [DocumentRef-doc:]LicenseRef-lic
 *  Nothing is known about a reference beyond its spelling. */
public final class LicenseRef implements LicName {
  public final String _doc;     // Document ref, without the "DocumentRef-" prefix; may be null
  public final String _lic;     // License ref, without the "LicenseRef-" prefix
  public LicenseRef( String doc, String lic ) { assert lic!=null; _doc=doc; _lic=lic; }

  @Override public boolean registered() { return false; }
  public SB str( SB sb ) {
    if( _doc!=null ) sb.p("DocumentRef-").p(_doc).p(':');
    return sb.p("LicenseRef-").p(_lic);
  }
  @Override public String toString() { return str(new SB()).toString(); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof LicenseRef ref && Objects.equals(_doc,ref._doc) && _lic.equals(ref._lic);
  }
  @Override public int hashCode() { return Objects.hashCode(_doc)*31+_lic.hashCode(); }
}

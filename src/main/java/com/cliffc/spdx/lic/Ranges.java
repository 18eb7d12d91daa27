package com.cliffc.spdx.lic;

import com.cliffc.spdx.SPDX;
import com.cliffc.spdx.util.Ary;

import java.util.HashMap;

/** License families, for "or-later" expressions like "GPL-2.0+".
 */

// Each family is the ordered list of versions of one license.  "L+" means L
// or any later version in L's family: the family suffix starting at L.  A
// license in no family has nothing later than itself.
//
//   GPL-1.0+  ==  GPL-1.0 \/ GPL-2.0 \/ GPL-3.0
//   GPL-2.0+  ==  GPL-2.0 \/ GPL-3.0
//   MIT+      ==  MIT
public abstract class Ranges {
  // Pluggable range table; maps a license to its ordered or-later members.
  // Allowed to return an empty list.
  public interface Lookup { Ary<LicenseId> range( LicenseId id ); }

  public static final Lookup DEFAULT = Ranges::lookupLicenseRange;

  private static final String[][] RANGES = new String[][]{
    {"AFL-1.1", "AFL-1.2", "AFL-2.0", "AFL-2.1", "AFL-3.0"},
    {"AGPL-1.0", "AGPL-3.0"},
    {"Apache-1.0", "Apache-1.1", "Apache-2.0"},
    {"APSL-1.0", "APSL-1.1", "APSL-1.2", "APSL-2.0"},
    {"Artistic-1.0", "Artistic-2.0"},
    {"CC-BY-1.0", "CC-BY-2.0", "CC-BY-2.5", "CC-BY-3.0", "CC-BY-4.0"},
    {"CC-BY-SA-1.0", "CC-BY-SA-2.0", "CC-BY-SA-2.5", "CC-BY-SA-3.0", "CC-BY-SA-4.0"},
    {"CDDL-1.0", "CDDL-1.1"},
    {"EPL-1.0", "EPL-2.0"},
    {"EUPL-1.0", "EUPL-1.1", "EUPL-1.2"},
    {"GFDL-1.1", "GFDL-1.2", "GFDL-1.3"},
    {"GPL-1.0", "GPL-2.0", "GPL-3.0"},
    {"LGPL-2.0", "LGPL-2.1", "LGPL-3.0"},
    {"LPPL-1.0", "LPPL-1.1", "LPPL-1.2", "LPPL-1.3a", "LPPL-1.3c"},
    {"MPL-1.0", "MPL-1.1", "MPL-2.0"},
    {"OFL-1.0", "OFL-1.1"},
  };
  private static final Ary<Ary<LicenseId>> FAMILIES = new Ary<>();
  private static final HashMap<LicenseId,Ary<LicenseId>> FAMILY = new HashMap<>();
  static {
    for( String[] range : RANGES ) {
      Ary<LicenseId> fam = new Ary<>();
      for( String s : range ) {
        LicenseId id = Licenses.mkLicenseId(s);
        if( id==null ) throw SPDX.TODO("range member is not a registered license: "+s);
        fam.add(id);
        FAMILY.put(id,fam);
      }
      FAMILIES.add(fam);
    }
  }

  // The license and every later version of it
  public static Ary<LicenseId> lookupLicenseRange( LicenseId id ) {
    Ary<LicenseId> fam = FAMILY.get(id);
    if( fam==null ) return new Ary<LicenseId>().add(id);
    return fam.from(fam.find(id));
  }

  // Copy of the whole family table
  public static Ary<Ary<LicenseId>> licenseRanges() {
    return FAMILIES.map(fam -> new Ary<LicenseId>().addAll(fam));
  }
}

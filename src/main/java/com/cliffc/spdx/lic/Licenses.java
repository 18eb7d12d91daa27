package com.cliffc.spdx.lic;

import com.cliffc.spdx.util.Ary;

import java.util.HashMap;

/** Registered SPDX license identifiers.
 */

// A representative slice of the SPDX license list: short identifier, full
// name and OSI approval.  Identifiers match exactly, case included.  The
// identifiers used in the "or-later" families of Ranges are all here.
public abstract class Licenses {
  private static final HashMap<String,LicenseId> IDS = new HashMap<>();
  private static final Ary<LicenseId> ALL = new Ary<>();
  private static void add( String id, String name, boolean osi ) {
    LicenseId lic = new LicenseId(id,name,osi);
    assert !IDS.containsKey(id) : "duplicate license "+id;
    IDS.put(id,lic);
    ALL.add(lic);
  }

  static {
    add("0BSD"            ,"BSD Zero Clause License"                          ,true );
    add("AFL-1.1"         ,"Academic Free License v1.1"                       ,true );
    add("AFL-1.2"         ,"Academic Free License v1.2"                       ,true );
    add("AFL-2.0"         ,"Academic Free License v2.0"                       ,true );
    add("AFL-2.1"         ,"Academic Free License v2.1"                       ,true );
    add("AFL-3.0"         ,"Academic Free License v3.0"                       ,true );
    add("AGPL-1.0"        ,"Affero General Public License v1.0"               ,false);
    add("AGPL-3.0"        ,"GNU Affero General Public License v3.0"           ,true );
    add("Apache-1.0"      ,"Apache License 1.0"                               ,false);
    add("Apache-1.1"      ,"Apache License 1.1"                               ,true );
    add("Apache-2.0"      ,"Apache License 2.0"                               ,true );
    add("APSL-1.0"        ,"Apple Public Source License 1.0"                  ,true );
    add("APSL-1.1"        ,"Apple Public Source License 1.1"                  ,true );
    add("APSL-1.2"        ,"Apple Public Source License 1.2"                  ,true );
    add("APSL-2.0"        ,"Apple Public Source License 2.0"                  ,true );
    add("Artistic-1.0"    ,"Artistic License 1.0"                             ,true );
    add("Artistic-2.0"    ,"Artistic License 2.0"                             ,true );
    add("BSD-2-Clause"    ,"BSD 2-Clause \"Simplified\" License"              ,true );
    add("BSD-3-Clause"    ,"BSD 3-Clause \"New\" or \"Revised\" License"      ,true );
    add("BSD-4-Clause"    ,"BSD 4-Clause \"Original\" or \"Old\" License"     ,false);
    add("BSL-1.0"         ,"Boost Software License 1.0"                       ,true );
    add("CC-BY-1.0"       ,"Creative Commons Attribution 1.0"                 ,false);
    add("CC-BY-2.0"       ,"Creative Commons Attribution 2.0"                 ,false);
    add("CC-BY-2.5"       ,"Creative Commons Attribution 2.5"                 ,false);
    add("CC-BY-3.0"       ,"Creative Commons Attribution 3.0"                 ,false);
    add("CC-BY-4.0"       ,"Creative Commons Attribution 4.0"                 ,false);
    add("CC-BY-SA-1.0"    ,"Creative Commons Attribution Share Alike 1.0"     ,false);
    add("CC-BY-SA-2.0"    ,"Creative Commons Attribution Share Alike 2.0"     ,false);
    add("CC-BY-SA-2.5"    ,"Creative Commons Attribution Share Alike 2.5"     ,false);
    add("CC-BY-SA-3.0"    ,"Creative Commons Attribution Share Alike 3.0"     ,false);
    add("CC-BY-SA-4.0"    ,"Creative Commons Attribution Share Alike 4.0"     ,false);
    add("CC0-1.0"         ,"Creative Commons Zero v1.0 Universal"             ,false);
    add("CDDL-1.0"        ,"Common Development and Distribution License 1.0"  ,true );
    add("CDDL-1.1"        ,"Common Development and Distribution License 1.1"  ,false);
    add("curl"            ,"curl License"                                     ,false);
    add("EPL-1.0"         ,"Eclipse Public License 1.0"                       ,true );
    add("EPL-2.0"         ,"Eclipse Public License 2.0"                       ,true );
    add("EUPL-1.0"        ,"European Union Public License 1.0"                ,false);
    add("EUPL-1.1"        ,"European Union Public License 1.1"                ,true );
    add("EUPL-1.2"        ,"European Union Public License 1.2"                ,true );
    add("GFDL-1.1"        ,"GNU Free Documentation License v1.1"              ,false);
    add("GFDL-1.2"        ,"GNU Free Documentation License v1.2"              ,false);
    add("GFDL-1.3"        ,"GNU Free Documentation License v1.3"              ,false);
    add("GPL-1.0"         ,"GNU General Public License v1.0 only"             ,false);
    add("GPL-2.0"         ,"GNU General Public License v2.0 only"             ,true );
    add("GPL-3.0"         ,"GNU General Public License v3.0 only"             ,true );
    add("ISC"             ,"ISC License"                                      ,true );
    add("JSON"            ,"JSON License"                                     ,false);
    add("LGPL-2.0"        ,"GNU Library General Public License v2 only"       ,true );
    add("LGPL-2.1"        ,"GNU Lesser General Public License v2.1 only"      ,true );
    add("LGPL-3.0"        ,"GNU Lesser General Public License v3.0 only"      ,true );
    add("libpng"          ,"libpng License"                                   ,false);
    add("LPPL-1.0"        ,"LaTeX Project Public License v1.0"                ,false);
    add("LPPL-1.1"        ,"LaTeX Project Public License v1.1"                ,false);
    add("LPPL-1.2"        ,"LaTeX Project Public License v1.2"                ,false);
    add("LPPL-1.3a"       ,"LaTeX Project Public License v1.3a"               ,false);
    add("LPPL-1.3c"       ,"LaTeX Project Public License v1.3c"               ,true );
    add("MIT"             ,"MIT License"                                      ,true );
    add("MPL-1.0"         ,"Mozilla Public License 1.0"                       ,true );
    add("MPL-1.1"         ,"Mozilla Public License 1.1"                       ,true );
    add("MPL-2.0"         ,"Mozilla Public License 2.0"                       ,true );
    add("MS-PL"           ,"Microsoft Public License"                         ,true );
    add("MS-RL"           ,"Microsoft Reciprocal License"                     ,true );
    add("NCSA"            ,"University of Illinois/NCSA Open Source License"  ,true );
    add("OFL-1.0"         ,"SIL Open Font License 1.0"                        ,false);
    add("OFL-1.1"         ,"SIL Open Font License 1.1"                        ,true );
    add("OpenSSL"         ,"OpenSSL License"                                  ,false);
    add("PostgreSQL"      ,"PostgreSQL License"                               ,true );
    add("Python-2.0"      ,"Python License 2.0"                               ,true );
    add("Ruby"            ,"Ruby License"                                     ,false);
    add("Unlicense"       ,"The Unlicense"                                    ,true );
    add("UPL-1.0"         ,"Universal Permissive License v1.0"                ,true );
    add("Vim"             ,"Vim License"                                      ,false);
    add("WTFPL"           ,"Do What The F*ck You Want To Public License"      ,false);
    add("X11"             ,"X11 License"                                      ,false);
    add("Zlib"            ,"zlib License"                                     ,true );
  }

  // Registered identifier, or null if 'id' is not a known license
  public static LicenseId mkLicenseId( String id ) { return IDS.get(id); }
  public static boolean isOsiApproved( LicenseId id ) { return id._osi; }
  // All registered licenses, in table order
  public static Ary<LicenseId> licenses() { return new Ary<LicenseId>().addAll(ALL); }
  public static Ary<String> licenseIdentifiers() { return ALL.map(l -> l._id); }
}

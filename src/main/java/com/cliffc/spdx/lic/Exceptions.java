package com.cliffc.spdx.lic;

import com.cliffc.spdx.util.Ary;

import java.util.HashMap;

// Registered SPDX license exceptions, the "X" in "GPL-2.0 WITH X".
public abstract class Exceptions {
  private static final HashMap<String,LicenseExceptionId> IDS = new HashMap<>();
  private static final Ary<LicenseExceptionId> ALL = new Ary<>();
  private static void add( String id, String name ) {
    LicenseExceptionId exc = new LicenseExceptionId(id,name);
    IDS.put(id,exc);
    ALL.add(exc);
  }

  static {
    add("389-exception"                  ,"389 Directory Server Exception");
    add("Autoconf-exception-2.0"         ,"Autoconf exception 2.0");
    add("Autoconf-exception-3.0"         ,"Autoconf exception 3.0");
    add("Bison-exception-2.2"            ,"Bison exception 2.2");
    add("Classpath-exception-2.0"        ,"Classpath exception 2.0");
    add("CLISP-exception-2.0"            ,"CLISP exception 2.0");
    add("eCos-exception-2.0"             ,"eCos exception 2.0");
    add("Font-exception-2.0"             ,"Font exception 2.0");
    add("FLTK-exception"                 ,"FLTK exception");
    add("FreeRTOS-exception-2.0"         ,"FreeRTOS Exception 2.0");
    add("GCC-exception-2.0"              ,"GCC Runtime Library exception 2.0");
    add("GCC-exception-3.1"              ,"GCC Runtime Library exception 3.1");
    add("Libtool-exception"              ,"Libtool Exception");
    add("LZMA-exception"                 ,"LZMA exception");
    add("Nokia-Qt-exception-1.1"         ,"Nokia Qt LGPL exception 1.1");
    add("OCaml-LGPL-linking-exception"   ,"OCaml LGPL Linking Exception");
    add("OpenJDK-assembly-exception-1.0" ,"OpenJDK Assembly exception 1.0");
    add("openvpn-openssl-exception"      ,"OpenVPN OpenSSL Exception");
    add("Qt-LGPL-exception-1.1"          ,"Qt LGPL exception 1.1");
    add("u-boot-exception-2.0"           ,"U-Boot exception 2.0");
    add("WxWindows-exception-3.1"        ,"WxWindows Library Exception 3.1");
  }

  // Registered exception, or null if 'id' is not a known exception
  public static LicenseExceptionId mkLicenseExceptionId( String id ) { return IDS.get(id); }
  public static Ary<LicenseExceptionId> licenseExceptions() { return new Ary<LicenseExceptionId>().addAll(ALL); }
}

package com.cliffc.spdx;

import com.cliffc.spdx.ast.*;
import com.cliffc.spdx.lic.*;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestParse {
  private static Simple lic( String id ) { return new Simple(Licenses.mkLicenseId(id),false,null); }

  // Parse, and check the pretty-print
  private static Expr test( String src, String expect ) {
    ExprEnv ee = SPDX.parseExpression(src);
    if( ee._err != null ) System.err.println(ee._err);
    assertNull(ee._err);
    assertEquals(expect,ee._expr.toString());
    return ee._expr;
  }
  private static Expr test( String src ) { return test(src,src); }

  // Parse, expecting an error at a level
  private static ErrMsg testerr( String src, ErrMsg.Level lvl, String msg ) {
    ExprEnv ee = SPDX.parseExpression(src);
    assertNull(ee._expr);
    assertNotNull(ee._err);
    assertEquals(lvl,ee._err._lvl);
    assertEquals(msg,ee._err._msg);
    return ee._err;
  }

  @Test public void testSimple() {
    assertEquals(lic("MIT"),test("MIT"));
    assertEquals(lic("GPL-2.0"),test("  GPL-2.0 ","GPL-2.0"));
    Simple s = (Simple)test("GPL-2.0+");
    assertTrue(s._plus);
    assertEquals(Licenses.mkLicenseId("GPL-2.0"),s._lic);
    s = (Simple)test("GPL-2.0+ WITH Classpath-exception-2.0");
    assertTrue(s._plus);
    assertEquals(Exceptions.mkLicenseExceptionId("Classpath-exception-2.0"),s._exc);
    test("(MIT)","MIT");
  }

  @Test public void testRefs() {
    Simple s = (Simple)test("LicenseRef-foo");
    assertEquals(new LicenseRef(null,"foo"),s._lic);
    s = (Simple)test("DocumentRef-spdx-tool-1.2:LicenseRef-MIT-Style-2");
    assertEquals(new LicenseRef("spdx-tool-1.2","MIT-Style-2"),s._lic);
    s = (Simple)test("LicenseRef-foo+ WITH GCC-exception-3.1");
    assertTrue(s._plus);
    assertFalse(s._lic.registered());
  }

  @Test public void testPrecedence() {
    // AND binds tighter than OR
    Expr e = test("MIT OR ISC AND Zlib");
    assertEquals(new Or(lic("MIT"),new And(lic("ISC"),lic("Zlib"))),e);
    e = test("MIT AND ISC OR Zlib");
    assertEquals(new Or(new And(lic("MIT"),lic("ISC")),lic("Zlib")),e);
    e = test("(MIT OR ISC) AND Zlib");
    assertEquals(new And(new Or(lic("MIT"),lic("ISC")),lic("Zlib")),e);
    // Left associative
    e = test("MIT OR ISC OR Zlib");
    assertEquals(new Or(new Or(lic("MIT"),lic("ISC")),lic("Zlib")),e);
    test("((MIT AND (ISC)))","MIT AND ISC");
    test("MIT AND (ISC OR Zlib) AND GPL-2.0+ WITH Classpath-exception-2.0");
    test("MIT\tAND\nISC","MIT AND ISC");
  }

  @Test public void testErrors() {
    testerr(""        ,ErrMsg.Level.Syntax          ,"Missing license expression");
    testerr("   "     ,ErrMsg.Level.Syntax          ,"Missing license expression");
    testerr("Bogus"   ,ErrMsg.Level.UnknownLicense  ,"Unknown license 'Bogus'");
    testerr("mit"     ,ErrMsg.Level.UnknownLicense  ,"Unknown license 'mit'");
    testerr("MIT WITH Bogus",ErrMsg.Level.UnknownException,"Unknown license exception 'Bogus'");
    testerr("MIT WITH",ErrMsg.Level.Syntax          ,"Missing license exception");
    testerr("MIT ISC" ,ErrMsg.Level.TrailingJunk    ,"Syntax error; trailing junk");
    testerr("MIT and ISC",ErrMsg.Level.TrailingJunk ,"Syntax error; trailing junk");
    testerr("MIT AND" ,ErrMsg.Level.Syntax          ,"Missing license");
    testerr("MIT AND OR ISC",ErrMsg.Level.Syntax    ,"Missing license");
    testerr("(MIT OR ISC",ErrMsg.Level.Syntax       ,"Expected closing ')' but ran out of text");
    testerr("(MIT OR ISC]",ErrMsg.Level.Syntax      ,"Expected closing ')' but found ']' instead");
    testerr("LicenseRef-",ErrMsg.Level.Syntax       ,"Bad license reference 'LicenseRef-'");
    testerr("DocumentRef-x",ErrMsg.Level.Syntax     ,"Bad license reference 'DocumentRef-x'");
    testerr("(MIT) WITH Classpath-exception-2.0",ErrMsg.Level.TrailingJunk,"Syntax error; trailing junk");
  }

  @Test public void testErrLoc() {
    ErrMsg err = testerr("MIT AND Foo",ErrMsg.Level.UnknownLicense,"Unknown license 'Foo'");
    assertEquals("expr:1:Unknown license 'Foo'\nMIT AND Foo\n        ^\n",err.toString());
    err = SPDX.parseExpression("pkg.cabal","MIT OR\nISC ISC")._err;
    assertEquals("pkg.cabal:2:Syntax error; trailing junk\nISC ISC\n    ^\n",err.toString());
    // Errors order by level, then by location
    ErrMsg e0 = SPDX.parseExpression("MIT AND")._err;
    ErrMsg e1 = SPDX.parseExpression("Foo")._err;
    ErrMsg e2 = SPDX.parseExpression("MIT ISC")._err;
    assertTrue(e0.compareTo(e1) < 0);
    assertTrue(e1.compareTo(e2) < 0);
    assertTrue(e2.compareTo(SPDX.parseExpression("MIT  ISC")._err) < 0);
    assertEquals(e0,SPDX.parseExpression("MIT AND")._err);
  }

  @Test public void testUnsafe() {
    assertEquals(lic("ISC"),SPDX.unsafeParseExpr("ISC"));
    try {
      SPDX.unsafeParseExpr("MIT AND");
      fail();
    } catch( IllegalArgumentException e ) {
      assertTrue(e.getMessage().contains("Missing license"));
    }
  }
}

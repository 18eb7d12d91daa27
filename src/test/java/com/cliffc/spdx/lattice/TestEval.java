package com.cliffc.spdx.lattice;

import com.cliffc.spdx.SPDX;
import com.cliffc.spdx.util.Ary;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.contrib.java.lang.system.SystemErrRule;

import static com.cliffc.spdx.lattice.Eval.*;
import static org.junit.Assert.*;

// The brute-force evaluator, and the lattice laws it has to agree with.
public class TestEval {
  @Rule public final SystemErrRule sysErr = new SystemErrRule().enableLog().muteForSuccessfulTests();
  @After public void reset() { SPDX.DEBUG = false; }

  private static final Lattice<String> X = Lattice.var("X");
  private static final Lattice<String> Y = Lattice.var("Y");
  private static final Lattice<String> Z = Lattice.var("Z");
  private static final Lattice<String> T = Lattice.top();
  private static final Lattice<String> F = Lattice.bot();

  // Collection of sample formulas for checking lattice properties.
  private static final Ary<Lattice<String>> LS = new Ary<Lattice<String>>()
    .add(X).add(Y).add(Z).add(T).add(F)
    .add(X.meet(Y)).add(X.join(Y)).add(Y.meet(X))
    .add(X.meet(Y).join(Z)).add(X.meet(Y.join(Z))).add(X.meet(Y).join(X.meet(Z)))
    .add(X.join(T)).add(X.meet(F)).add(X.join(Y.meet(Z)).dual())
    .add(X.meet(Y).meet(Z)).add(Z.join(F).meet(X.join(T)));

  @Test public void testScenarios() {
    assertTrue (equivalent(X.meet(Y),Y.meet(X)));
    assertTrue (equivalent(X,X.meet(X)));
    assertFalse(equivalent(X.meet(Y),Y.meet(Y)));
    assertTrue (preorder(X.meet(Y),X));
    assertFalse(preorder(X,X.meet(Y)));
  }

  @Test public void testBounds() {
    assertTrue (equivalent(T,T));
    assertFalse(equivalent(T,F));
    assertTrue (equivalent(X.join(T),T));
    assertTrue (equivalent(X.meet(F),F));
    assertTrue (equivalent(X.meet(T),X));
    assertTrue (equivalent(X.join(F),X));
    assertTrue (preorder(F,T));
    assertFalse(preorder(T,F));
  }

  @Test public void testLaws() {
    for( Lattice<String> a : LS ) {
      assertTrue(a+" idempotent",equivalent(a,a.meet(a)));
      assertTrue(a+" idempotent",equivalent(a,a.join(a)));
      assertTrue(a+" double dual",equivalent(a.dual().dual(),a));
      assertTrue(a+" reflexive",preorder(a,a));
      assertTrue(a+" above bot",preorder(F,a));
      assertTrue(a+" below top",preorder(a,T));
      for( Lattice<String> b : LS ) {
        assertTrue(equivalent(a.meet(b),b.meet(a)));
        assertTrue(equivalent(a.join(b),b.join(a)));
        assertTrue(equivalent(a.join(a.meet(b)),a)); // Absorption
        assertEquals(equivalent(a,b),equivalent(b,a));
        assertEquals(preorder(a,b),a.isa(b));
        if( preorder(a,b) && preorder(b,a) )
          assertTrue(a+" and "+b+" antisymmetric",equivalent(a,b));
        // a <= b  iff  a /\ b == a
        assertEquals(preorder(a,b),equivalent(a.meet(b),a));
      }
    }
  }

  @Test public void testDistributive() {
    assertTrue(equivalent(X.meet(Y.join(Z)),X.meet(Y).join(X.meet(Z))));
    assertTrue(equivalent(X.join(Y.meet(Z)),X.join(Y).meet(X.join(Z))));
    assertTrue(preorder(X.meet(Y).meet(Z),X.join(Z)));
    assertFalse(preorder(X.join(Z),X.meet(Y)));
  }

  @Test public void testSatisfiable() {
    assertTrue (satisfiable(X));
    assertTrue (satisfiable(T));
    assertFalse(satisfiable(F));
    assertFalse(satisfiable(X.meet(F)));
    assertTrue (satisfiable(X.join(F)));
    assertTrue (satisfiable(X.meet(Y).meet(Z)));
    assertFalse(satisfiable(X.meet(Y).meet(F.join(Z.meet(F)))));
  }

  // A join whose left side is true never looks at its right side
  @Test public void testShortCircuit() {
    Ary<Outcome<String>> outs = outcomes(X.join(Y));
    assertEquals("{{X=T} -> T,{X=F,Y=T} -> T,{X=F,Y=F} -> F}",outs.toString());
    outs = outcomes(X.meet(Y));
    assertEquals("{{X=T,Y=T} -> T,{X=T,Y=F} -> F,{X=F} -> F}",outs.toString());
    // Constant left sides prune the other side entirely
    assertEquals("{{} -> T}",outcomes(T.join(X.meet(Y))).toString());
    assertEquals("{{} -> F}",outcomes(F.meet(X.join(Y))).toString());
  }

  // A variable gets one value per path, no matter how often it appears
  @Test public void testConsistent() {
    assertEquals("{{X=T} -> T,{X=F} -> F}",outcomes(X.meet(X)).toString());
    Ary<Outcome<String>> outs = outcomes(X.meet(Y).join(Y.meet(X)));
    for( Outcome<String> out : outs ) {
      Ary<String> vs = out._asgn.vars();
      for( int i=0; i<vs.len(); i++ )
        for( int j=i+1; j<vs.len(); j++ )
          assertNotEquals(vs.at(i),vs.at(j));
      assertEquals(out._asgn.get("X") && out._asgn.get("Y"),out._a);
    }
  }

  // Two formulas share each path's assignment
  @Test public void testPairs() {
    Ary<Outcome<String>> outs = outcomes(X,X.meet(Y));
    assertEquals("{{X=T,Y=T} -> (T,T),{X=T,Y=F} -> (T,F),{X=F} -> (F,F)}",outs.toString());
    assertEquals(1,outcomes(T,F).len());
    assertFalse(outcomes(T,F).at(0)._b);
  }

  @Test public void testAsgn() {
    Asgn<String> e = Asgn.empty();
    Asgn<String> x = e.put("X",true);
    Asgn<String> xy = x.put("Y",false);
    Asgn<String> xz = x.put("Z",true);
    assertNull(e.get("X"));
    assertEquals(Boolean.TRUE ,xy.get("X"));
    assertEquals(Boolean.FALSE,xy.get("Y"));
    assertNull(xy.get("Z"));      // Sibling branch binding not visible
    assertNull(xz.get("Y"));
    assertEquals(1,x.len());
    assertEquals("{X=T,Y=F}",xy.toString());
    assertEquals("{}",e.toString());
  }

  @Test public void testCounterexample() {
    SPDX.DEBUG = true;
    assertFalse(equivalent(X,X.meet(Y)));
    assertEquals("Not equivalent: X is true but (X /\\ Y) is false under {X=T,Y=F}"+System.lineSeparator(),sysErr.getLog());
    sysErr.clearLog();
    assertTrue(equivalent(X,X.meet(X)));
    assertTrue(sysErr.getLog().isEmpty());
  }
}

package com.cliffc.spdx;

import com.cliffc.spdx.ast.Expr;
import com.cliffc.spdx.lattice.Eval;
import com.cliffc.spdx.lattice.Lattice;
import com.cliffc.spdx.lic.Ranges;
import org.jetbrains.annotations.NotNull;

/** SPDX license expressions and license-policy checking.
 */

// Entry points.  A license expression is parsed into an Expr tree, the tree is
// translated into a Lattice over license terms (Lic), and the lattice
// preorder answers "does this package license satisfy that policy?".

public abstract class SPDX {
  public static RuntimeException TODO( String msg) { throw new RuntimeException(msg); }

  // Parse a license expression.  Never throws on bad text; errors come back
  // in the ExprEnv.
  public static @NotNull ExprEnv parseExpression( String str ) { return parseExpression("expr",str); }
  public static @NotNull ExprEnv parseExpression( String src, String str ) {
    Parse P = new Parse(src,str);
    ErrMsg err = P.go();
    return new ExprEnv(err==null ? P._expr : null, err);
  }

  // Parse a license expression, throwing on bad text
  public static @NotNull Expr unsafeParseExpr( String str ) {
    ExprEnv ee = parseExpression(str);
    if( ee._err != null ) throw new IllegalArgumentException(ee._err.toString());
    return ee._expr;
  }

  // True if the package license satisfies the license policy:
  //   satisfies(pkg,policy) == policy <= pkg
  // The policy must entail the package license.
  public static boolean satisfies( Expr pkg, Expr policy ) { return satisfies(pkg,policy,Ranges.DEFAULT); }
  public static boolean satisfies( Expr pkg, Expr policy, Ranges.Lookup ranges ) {
    Lattice<Lic> lpkg = pkg   .lattice(ranges);
    Lattice<Lic> lpol = policy.lattice(ranges);
    boolean sat = Eval.preorder(lpol,lpkg);
    p(sat,"satisfies: "+pkg+" by "+policy+" is "+sat);
    return sat;
  }
  public static boolean satisfies( String pkg, String policy ) {
    return satisfies(unsafeParseExpr(pkg),unsafeParseExpr(policy));
  }

  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !SPDX.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}

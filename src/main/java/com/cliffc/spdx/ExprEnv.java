package com.cliffc.spdx;

import com.cliffc.spdx.ast.Expr;

// Result of parsing a license expression: the expression, or the error
public class ExprEnv {
  public final Expr _expr;      // Parsed expression, null on error
  public final ErrMsg _err;     // First error, null if none
  ExprEnv( Expr expr, ErrMsg err ) { assert (expr==null) != (err==null); _expr=expr; _err=err; }
}

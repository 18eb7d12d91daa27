package com.cliffc.spdx.ast;

import com.cliffc.spdx.Lic;
import com.cliffc.spdx.lattice.Lattice;
import com.cliffc.spdx.lic.Ranges;
import com.cliffc.spdx.util.SB;

/** SPDX license expression tree, as parsed.
 */

// A license expression is a binary tree of AND and OR over simple license
// expressions.  Each kind knows how to print itself back to SPDX syntax and
// how to translate itself into a license Lattice:
//
//   MIT                  ==>  Var(MIT)
//   GPL-2.0+             ==>  Var(GPL-2.0) \/ Var(GPL-3.0)
//   MIT AND ISC          ==>  Var(MIT) /\ Var(ISC)
//   MIT OR ISC           ==>  Var(MIT) \/ Var(ISC)

public abstract class Expr {
  // Default toString
  @Override public final String toString() { return str(new SB()).toString(); }

  // Everybody has to have a pretty print
  abstract public SB str( SB sb );

  // Binding strength for printing: OR=1, AND=2, simple=3.  A child binding
  // weaker than its parent gets parens.
  abstract int prec();
  final SB str( SB sb, int prec ) {
    return prec() < prec ? str(sb.p('(')).p(')') : str(sb);
  }

  // Translate into a lattice over license terms, expanding "or-later"
  // licenses with the given range table.
  abstract public Lattice<Lic> lattice( Ranges.Lookup ranges );
  public final Lattice<Lic> lattice() { return lattice(Ranges.DEFAULT); }
}

package com.cliffc.spdx.lattice;

import com.cliffc.spdx.util.Ary;
import com.cliffc.spdx.util.SB;

/** Variable assignment along one search path.
 */

// Immutable cons-list of (variable,boolean) bindings, newest first.  Forking a
// search path conses a new binding in front; the two forked branches share
// their common prefix and can never see each other's bindings.  A variable is
// bound at most once per path, so every occurrence of a variable on a path
// agrees on its value.
@SuppressWarnings("unchecked")
public final class Asgn<T> {
  final T _v;                   // Variable
  final boolean _b;             // Value guessed for the variable
  final Asgn<T> _next;          // Older bindings
  final int _len;               // Count of bindings, zero for the empty path
  private Asgn( T v, boolean b, Asgn<T> next, int len ) { _v=v; _b=b; _next=next; _len=len; }

  private static final Asgn EMPTY = new Asgn<>(null,false,null,0);
  public static <T> Asgn<T> empty() { return EMPTY; }

  public int len() { return _len; }

  // Value of 'v' on this path, or null if not guessed yet
  public Boolean get( T v ) {
    for( Asgn<T> a = this; a._len>0; a = a._next )
      if( a._v.equals(v) )
        return a._b;
    return null;
  }

  // Extend the path by one binding; this path is unchanged
  Asgn<T> put( T v, boolean b ) {
    assert get(v)==null : "rebinding "+v;
    return new Asgn<>(v,b,this,_len+1);
  }

  // Bound variables, oldest first; i.e. in the order they were guessed
  public Ary<T> vars() {
    Ary<T> vs = new Ary<>((T[])new Object[Math.max(1,_len)],_len);
    for( Asgn<T> a = this; a._len>0; a = a._next )
      vs._es[a._len-1] = a._v;
    return vs;
  }

  @Override public String toString() {
    SB sb = new SB().p('{');
    Ary<T> vs = vars();
    for( T v : vs )
      sb.pobj(v).p('=').p(get(v) ? 'T' : 'F').p(',');
    if( _len>0 ) sb.unchar();
    return sb.p('}').toString();
  }
}

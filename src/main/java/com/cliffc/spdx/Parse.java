package com.cliffc.spdx;

import com.cliffc.spdx.ast.*;
import com.cliffc.spdx.lic.*;
import com.cliffc.spdx.util.SB;

/*** SPDX license expression parser
 *
 *  GRAMMAR:
 *  prog   = expr END
 *  expr   = term [OR term]*         // OR binds loosest, left associative
 *  term   = with [AND with]*        // AND binds tighter than OR
 *  with   = ( expr )                // Parens; no exception allowed after
 *  with   = simple [WITH excid]     // Optional license exception
 *  simple = licref | licid[+]       // '+' is "or-later"
 *  licref = [DocumentRef-idstr:]LicenseRef-idstr[+]
 *  licid  = registered license identifier; case-sensitive
 *  excid  = registered license exception identifier
 *  idstr  = [A-Za-z0-9.-]+
 *
 *  Keywords AND, OR, WITH are upper-case and whitespace separated.
 */

public class Parse implements Comparable<Parse> {
  private final String _src;    // Source for error messages; usually a file name
  private final byte[] _buf;    // Bytes being parsed
  private int _x;               // Parser index
  private ErrMsg _err;          // First error found, if any
  Expr _expr;                   // Result of a successful parse

  Parse( String src, String str ) {
    _src = src;
    _buf = str.getBytes();
    _x   = 0;
  }

  /** Parse a top-level:
   *  prog = expr END
   *  Returns the first error, or null and the result is in _expr */
  ErrMsg go() {
    if( skipWS() == -1 ) return ErrMsg.syntax(errMsg(),"Missing license expression");
    Expr e = expr();
    if( e == null ) return _err;
    if( skipWS() != -1 ) return ErrMsg.trailingjunk(errMsg());
    _expr = e;
    return null;
  }

  /** Parse a disjunction, left associative
   *  expr = term [OR term]* */
  private Expr expr() {
    Expr l = term();
    while( l != null && peek_kw("OR") ) {
      Expr r = term();
      l = r==null ? null : new Or(l,r);
    }
    return l;
  }

  /** Parse a conjunction, left associative
   *  term = with [AND with]* */
  private Expr term() {
    Expr l = with();
    while( l != null && peek_kw("AND") ) {
      Expr r = with();
      l = r==null ? null : new And(l,r);
    }
    return l;
  }

  /** Parse a parenthesized expression, or a simple license with an optional
   *  exception.
   *  with = ( expr )
   *  with = simple [WITH excid] */
  private Expr with() {
    if( peek('(') ) {
      int oldx = _x-1;
      Expr e = expr();
      if( e == null ) return null;
      if( !peek(')') ) return err(ErrMsg.syntax(errMsg(oldx),"Expected closing ')' but "+(skipWS()==-1?"ran out of text":"found '"+(char)(_buf[_x])+"' instead")));
      return e;
    }
    Simple s = simple();
    if( s == null || !peek_kw("WITH") ) return s;
    skipWS();
    int x = _x;
    String tok = token0();
    if( tok == null || isKW(tok) ) { _x = x; return err(ErrMsg.syntax(errMsg(),"Missing license exception")); }
    LicenseExceptionId exc = Exceptions.mkLicenseExceptionId(tok);
    if( exc == null ) return err(ErrMsg.unknownException(errMsg(x),tok));
    return new Simple(s._lic,s._plus,exc);
  }

  /** Parse a simple license, registered or free-form, with an optional '+'
   *  simple = licref | licid[+] */
  private Simple simple() {
    skipWS();
    int x = _x;
    String tok = token0();
    if( tok == null || isKW(tok) ) { _x = x; return err(ErrMsg.syntax(errMsg(),"Missing license")); }
    LicName lic;
    if( tok.startsWith("LicenseRef-") || tok.startsWith("DocumentRef-") ) {
      lic = ref(tok);
      if( lic == null ) return err(ErrMsg.syntax(errMsg(x),"Bad license reference '"+tok+"'"));
    } else {
      lic = Licenses.mkLicenseId(tok);
      if( lic == null ) return err(ErrMsg.unknownLicense(errMsg(x),tok));
    }
    boolean plus = peek_noWS('+');
    return new Simple(lic,plus,null);
  }

  // Split a reference token; null if malformed.
  //   [DocumentRef-doc:]LicenseRef-lic
  private static LicenseRef ref( String tok ) {
    String doc = null;
    if( tok.startsWith("DocumentRef-") ) {
      int colon = tok.indexOf(':');
      if( colon == -1 ) return null;
      doc = tok.substring("DocumentRef-".length(),colon);
      if( doc.isEmpty() ) return null;
      tok = tok.substring(colon+1);
    }
    if( !tok.startsWith("LicenseRef-") ) return null;
    String lic = tok.substring("LicenseRef-".length());
    if( lic.isEmpty() || lic.indexOf(':') != -1 ) return null;
    return new LicenseRef(doc,lic);
  }

  // Record the first error, return null to unwind
  private <E> E err( ErrMsg err ) {
    if( _err == null ) _err = err;
    return null;
  }

  // Lexical tokens.  Any run of idstring characters, plus ':' for document
  // references.  Stops at WS, parens and '+'.
  private String token0() {
    if( _x >= _buf.length ) return null;
    int x = _x;
    while( _x < _buf.length && (isId(_buf[_x]) || _buf[_x]==':') ) _x++;
    return x==_x ? null : new String(_buf,x,_x-x);
  }
  private static boolean isKW( String s ) { return s.equals("AND") || s.equals("OR") || s.equals("WITH"); }

  // Skip WS, return true&skip if match, false & do not skip if miss.
  private boolean peek( char c ) { return peek1(skipWS(),c); }
  private boolean peek_noWS( char c ) { return peek1(_x >= _buf.length ? -1 : _buf[_x],c); }
  // Already skipped WS & have character;
  // return true & skip if a match, false& do not skip if a miss.
  private boolean peek1( byte c0, char c ) {
    assert c0==-1 || c0== _buf[_x];
    if( c0!=c ) return false;
    _x++;                       // Skip peeked character
    return true;
  }
  // Skip WS, match a whole keyword: not followed by more idstring characters
  private boolean peek_kw( String kw ) {
    skipWS();
    int len = kw.length();
    if( _x+len > _buf.length ) return false;
    for( int i=0; i<len; i++ )
      if( _buf[_x+i] != kw.charAt(i) )
        return false;
    if( _x+len < _buf.length && isId(_buf[_x+len]) ) return false;
    _x += len;
    return true;
  }

  /** Advance parse pointer to the first non-whitespace character, and return
   *  that character, -1 otherwise.  */
  private byte skipWS() {
    while( _x < _buf.length ) {
      byte c = _buf[_x];
      if( !isWS(c) ) return c;
      _x++;
    }
    return -1;
  }

  /** Return true if `c` passes a test */
  private static boolean isWS(byte c) { return c == ' ' || c == '\t' || c == '\n' || c == '\r'; }
  private static boolean isId(byte c) {
    return ('a'<=c && c <= 'z') || ('A'<=c && c <= 'Z') || ('0'<=c && c <= '9') || c=='-' || c=='.';
  }

  // Make a private clone just for delayed error messages
  private Parse( Parse P ) {
    _src  = P._src;
    _buf  = P._buf;
    _x    = P._x;
  }
  // Delayed error message, just record char index and share text buffer
  Parse errMsg() { return errMsg(_x); }
  Parse errMsg(int x) { Parse P = new Parse(this); P._x=x; return P; }

  // Build a string of the given message, the current line being parsed,
  // and line of the pointer to the current index.
  public String errLocMsg(String s) {
    // find line start
    int a=_x;
    while( a > 0 && _buf[a-1] != '\n' ) --a;
    if( a < _buf.length && _buf[a]=='\r' ) a++; // do not include leading \n or \n\r
    // find line end
    int b=_x;
    while( b < _buf.length && _buf[b] != '\n' && _buf[b] != '\r' ) b++;
    // 1-based line number
    int line=1;
    for( int i=0; i<a; i++ ) if( _buf[i]=='\n' ) line++;
    SB sb = new SB().p(_src).p(':').p(line).p(':').p(s).nl();
    sb.p(new String(_buf,a,b-a)).nl();
    for( int i=a; i<_x; i++ )
      sb.p(' ');
    return sb.p('^').nl().toString();
  }

  // Handy for the debugger to print
  @Override public String toString() { return new String(_buf,_x,_buf.length-_x); }

  @Override public boolean equals(Object loc) {
    if( this==loc ) return true;
    if( !(loc instanceof Parse p) ) return false;
    return _x==p._x && _src.equals(p._src);
  }
  @Override public int hashCode() {
    return _src.hashCode()+_x;
  }
  // Ordering for error messages
  @Override public int compareTo(Parse loc) {
    int x = _src.compareTo(loc._src);
    if( x!=0 ) return x;
    return _x - loc._x;
  }
}

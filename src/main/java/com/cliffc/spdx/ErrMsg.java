package com.cliffc.spdx;

// Error messages
public class ErrMsg implements Comparable<ErrMsg> {

  // Error levels
  public enum Level {
    Syntax,                   // Syntax
    UnknownLicense,           // Not a registered license identifier
    UnknownException,         // Not a registered license exception
    TrailingJunk,             // Trailing syntax junk
  }

  public final Parse _loc;    // Point in text to blame
  public final String _msg;   // Printable error message, minus text context
  public final Level _lvl;    // Priority for printing
  public ErrMsg(Parse loc, String msg, Level lvl) { _loc=loc; _msg=msg; _lvl=lvl; }
  public static ErrMsg syntax(Parse loc, String msg) {
    return new ErrMsg(loc,msg,Level.Syntax);
  }
  public static ErrMsg unknownLicense(Parse loc, String id) {
    return new ErrMsg(loc,"Unknown license '"+id+"'",Level.UnknownLicense);
  }
  public static ErrMsg unknownException(Parse loc, String id) {
    return new ErrMsg(loc,"Unknown license exception '"+id+"'",Level.UnknownException);
  }
  public static ErrMsg trailingjunk(Parse loc) {
    return new ErrMsg(loc,"Syntax error; trailing junk",Level.TrailingJunk);
  }

  @Override public String toString() {
    return _loc==null ? _msg : _loc.errLocMsg(_msg);
  }
  @Override public int compareTo(ErrMsg msg) {
    int cmp = _lvl.compareTo(msg._lvl);
    if( cmp != 0 ) return cmp;
    return _loc==null || msg._loc==null ? 0 : _loc.compareTo(msg._loc);
  }
  @Override public boolean equals(Object obj) {
    if( this==obj ) return true;
    if( !(obj instanceof ErrMsg err) ) return false;
    if( _lvl!=err._lvl || !_msg.equals(err._msg) ) return false;
    return _loc==err._loc || (_loc!=null && _loc.equals(err._loc));
  }
  @Override public int hashCode() {
    return (_loc==null ? 0 : _loc.hashCode())+_msg.hashCode()+_lvl.hashCode();
  }
}

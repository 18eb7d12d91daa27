package com.cliffc.spdx.util;

import java.util.Arrays;
import java.util.Iterator;
import java.util.function.Function;

// ArrayList with saner syntax
@SuppressWarnings("unchecked")
public class Ary<E> implements Iterable<E> {
  public E[] _es;
  public int _len;
  public Ary(E[] es, int len) { _es=es; _len=len; }
  public Ary() { this((E[])new Object[2],0); }

  /** @return list is empty */
  public boolean isEmpty() { return _len==0; }
  /** @return active list length */
  public int len() { return _len; }
  /** @param i element index
   *  @return element being returned; throws if OOB */
  public E at( int i ) {
    range_check(i);
    return _es[i];
  }

  /** Add element in amortized constant time
   *  @param e Element to add at end of list
   *  @return 'this' for flow-coding */
  public Ary<E> add( E e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    _es[_len++] = e;
    return this;
  }

  /** @param c Ary to be appended */
  public Ary<E> addAll( Ary<? extends E> c ) {
    if( c._len==0 ) return this;
    while( _len+c._len > _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    System.arraycopy(c._es,0,_es,_len,c._len);
    _len += c._len;
    return this;
  }

  /** Elements from index 'lo' to the end, as a new Ary */
  public Ary<E> from( int lo ) {
    if( lo < 0 || lo > _len ) throw new ArrayIndexOutOfBoundsException(""+lo+" > "+_len);
    return new Ary<>(Arrays.copyOfRange(_es,lo,Math.max(_len,lo+1)),_len-lo);
  }

  /** @param f function to apply to each element
   *  @return a new Ary of the results, in order */
  public <F> Ary<F> map( Function<E,F> f ) {
    Ary<F> fs = new Ary<>((F[])new Object[Math.max(1,_len)],0);
    for( int i=0; i<_len; i++ ) fs.add(f.apply(_es[i]));
    return fs;
  }

  /** Find the first element equal to 'e', or -1 if none. */
  public int find( E e ) {
    for( int i=0; i<_len; i++ )  if( _es[i]==e || (e!=null && e.equals(_es[i])) )  return i;
    return -1;
  }
  /** @return an iterator */
  @Override public Iterator<E> iterator() { return new Iter(); }
  private class Iter implements Iterator<E> {
    int _i=0;
    @Override public boolean hasNext() { return _i<_len; }
    @Override public E next() { return _es[_i++]; }
  }

  // Order-sensitive equals, for tests
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Ary ary) ) return false;
    if( _len != ary._len ) return false;
    for( int i=0; i<_len; i++ )
      if( !(_es[i]==null ? ary._es[i]==null : _es[i].equals(ary._es[i])) )
        return false;
    return true;
  }
  @Override public int hashCode() {
    int sum=_len;
    for( int i=0; i<_len; i++ )
      sum += _es[i]==null ? 0 : _es[i].hashCode();
    return sum;
  }

  @Override public String toString() {
    SB sb = new SB().p('{');
    for( int i=0; i<_len; i++ ) {
      if( i>0 ) sb.p(',');
      if( _es[i] != null ) sb.p(_es[i].toString());
    }
    return sb.p('}').toString();
  }

  private void range_check( int i ) {
    if( i < 0 || i>=_len )
      throw new ArrayIndexOutOfBoundsException(""+i+" >= "+_len);
  }

}

package com.cliffc.eq.util;

public class Util {
  // Mixing step from http://burtleburtle.net/bob/c/lookup3.c, without the
  // global statics so concurrent term construction does not interfere.
  private static int rot(int x, int k) { return (x<<k) | (x>>>(32-k)); }
  public static int mix_hash( int a, int b ) {
    int c = 0x9e3779b9;
    a -= c;  a ^= rot(c, 4);  c += b;
    b -= a;  b ^= rot(a, 6);  a += c;
    c -= b;  c ^= rot(b, 8);  b += a;
    a -= c;  a ^= rot(c,16);  c += b;
    b -= a;  b ^= rot(a,19);  a += c;
    c -= b;  c ^= rot(b, 4);  b += a;
    int hash = c;
    if( hash==0 ) hash=b;
    if( hash==0 ) hash=a;
    if( hash==0 ) hash=0xcafebabe;
    return hash;
  }

  // Lexical compare of two arrays; a strict prefix sorts first.
  public static <E extends Comparable<? super E>> int compare( E[] as, E[] bs ) {
    int len = Math.min(as.length,bs.length);
    for( int i=0; i<len; i++ ) {
      int x = as[i].compareTo(bs[i]);
      if( x!=0 ) return x;
    }
    return Integer.compare(as.length,bs.length);
  }
}

package com.cliffc.eq;

/** Equality of first-order terms under a premise.
 *
 *  Global flags and debug helpers, shared by the term, premise and equality
 *  code.  There is no logging layer; debug printing goes to stderr when
 *  {@link #DEBUG} is set.
 */
public abstract class EQ {
  // Debug printers, set with -Deq.debug=true
  public static boolean DEBUG = Boolean.getBoolean("eq.debug");
  public static <T> T p(T x, String s) {
    if( !EQ.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}

package com.cliffc.eq.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing of terms
 *  and premises. */
public final class SB {
  public final StringBuilder _sb;
  int _indent = 0;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  // Not spelled "p" on purpose: atoms are host objects and a stray "p(x)"
  // should not silently pick this up.
  public SB pobj( Object s ) { _sb.append(s); return this; }
  public SB i( int d ) { for( int i=0; i<d+_indent; i++ ) p("  "); return this; }
  public SB i( ) { return i(0); }

  // Increase indentation
  public SB ii( int i) { _indent += i; return this; }
  // Decrease indentation
  public SB di( int i) { _indent -= i; return this; }

  public SB nl( ) { return p('\n'); }
  // Remove the last char, typically a trailing separator
  public SB unchar() { _sb.setLength(_sb.length()-1); return this; }

  @Override public String toString() { return _sb.toString(); }
}

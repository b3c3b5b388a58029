package com.cliffc.eq.term;

/** Callback for {@link Term#visit}.  Return false to stop the walk. */
@FunctionalInterface
public interface Visitor<L extends Comparable<L>> {
  boolean visit( Term<L> t );
}

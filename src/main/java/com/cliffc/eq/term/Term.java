package com.cliffc.eq.term;

import com.cliffc.eq.util.SB;
import org.jetbrains.annotations.NotNull;

/** First-order terms.
 *
 * A term is one of three closed shapes over host-supplied atoms {@code L}:
 *
 *    T = a                | // TermAtom, a leaf wrapping an atom
 *        f(T*)            | // TermFun, symbol plus ordered arguments
 *        f<T*>            | // TermNorm, same shape as TermFun but may expand via an alias
 *
 * Terms are immutable values.  Equality is deep and structural, the hash is
 * computed once at construction, and the ordering is total: shape first
 * (TermAtom < TermFun < TermNorm), then atom, then symbol and arguments
 * lexically.  The ordering carries no meaning beyond being stable, and is
 * used to key the sorted maps in a Premise.
 */
public abstract class Term<L extends Comparable<L>> implements Comparable<Term<L>> {
  // Shape tags, also the ordering between shapes
  static final byte TATOM=0, TFUN=1, TNORM=2;

  final int _hash;              // Deep structural hash
  Term( int hash ) { _hash = hash; }

  abstract byte tag();

  // Number of direct sub-terms
  public int len() { return 0; }
  // Fetch a direct sub-term
  public Term<L> arg( int i ) { throw new IndexOutOfBoundsException(""+i+" >= "+len()); }

  // -----------------
  // Pre-order walk.  Visit this term, then each argument left to right.  A
  // false from the visitor stops the entire walk, and the walk reports false.
  public final boolean visit( @NotNull Visitor<L> v ) {
    if( !v.visit(this) ) return false;
    for( int i=0; i<len(); i++ )
      if( !arg(i).visit(v) )
        return false;
    return true;
  }

  // -----------------
  // Substitution.  If this term equals 'from' it becomes 'to'; then, replaced
  // or not, the arguments are recursively rewritten the same way.  Note that
  // the rewrite continues into a freshly inserted 'to', so 'to' must not
  // itself strictly contain 'from'.  Returns 'this' if nothing changed.
  public final Term<L> apply( @NotNull Term<L> from, @NotNull Term<L> to ) {
    Term<L> t = equals(from) ? to : this;
    return t._apply_args(from,to);
  }
  // Rewrite all arguments, keeping the shape and symbol
  abstract Term<L> _apply_args( Term<L> from, Term<L> to );

  // -----------------
  @Override public final int hashCode() { return _hash; }
  @Override public final boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Term) ) return false;
    Term<?> t = (Term<?>)o;
    if( _hash != t._hash || tag() != t.tag() ) return false;
    return _equals_impl(t);
  }
  // Same shape and hash already checked
  abstract boolean _equals_impl( Term<?> t );

  @Override public final int compareTo( @NotNull Term<L> t ) {
    if( this==t ) return 0;
    if( tag() != t.tag() ) return Byte.compare(tag(),t.tag());
    return _compare_impl(t);
  }
  // Same shape already checked
  abstract int _compare_impl( Term<L> t );

  @Override public final String toString() { return str(new SB()).toString(); }
  public abstract SB str( SB sb );
}

package com.cliffc.eq.premise;

import com.cliffc.eq.term.Term;
import com.cliffc.eq.term.TermAtom;
import com.cliffc.eq.util.SB;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** An alias definition, much like a parameterized type alias:
 *
 *    alias f<p0,p1> = equivalence
 *
 *  Expanding {@code f<a0,a1>} substitutes each parameter in turn, first to
 *  last, into the progressively rewritten equivalence.  The order matters:
 *  a parameter atom that reappears inside an earlier argument is replaced
 *  again by the later substitution.
 */
public final class Normalization<L extends Comparable<L>> {
  private final L[] _params;
  private final Term<L> _equiv;

  @SuppressWarnings("unchecked")
  Normalization( @NotNull List<L> params, @NotNull Term<L> equiv ) {
    _params = (L[])params.toArray(new Comparable[0]);
    for( L p : _params ) Objects.requireNonNull(p,"null parameter");
    _equiv = Objects.requireNonNull(equiv);
  }

  public List<L> params() { return List.of(_params); }
  public Term<L> equivalence() { return _equiv; }

  /** Expand this alias at the given arguments.  Each substitution goes
   *  through {@link Term#apply}, so an argument must not contain the atom of
   *  its own parameter: {@code alias 0<0> = 10(0)} expanded at {@code <10(0)>}
   *  rewrites forever and ends in a {@link StackOverflowError}.
   *  @param args one concrete term per parameter
   *  @return the expansion, or null if the argument count does not match */
  public @Nullable Term<L> expand( @NotNull List<? extends Term<L>> args ) {
    if( args.size() != _params.length ) return null;
    Term<L> t = _equiv;
    for( int i=0; i<_params.length; i++ )
      t = t.apply(TermAtom.make(_params[i]),args.get(i));
    return t;
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Normalization) ) return false;
    Normalization<?> n = (Normalization<?>)o;
    return Arrays.equals(_params,n._params) && _equiv.equals(n._equiv);
  }
  @Override public int hashCode() { return Arrays.hashCode(_params)*31 + _equiv.hashCode(); }

  @Override public String toString() { return str(new SB()).toString(); }
  SB str( SB sb ) {
    sb.p('<');
    for( L p : _params ) sb.pobj(p).p(',');
    if( _params.length>0 ) sb.unchar();
    return _equiv.str(sb.p("> = "));
  }
}

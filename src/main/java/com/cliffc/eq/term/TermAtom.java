package com.cliffc.eq.term;

import com.cliffc.eq.util.SB;
import com.cliffc.eq.util.Util;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/** A leaf term wrapping a single host atom. */
public final class TermAtom<L extends Comparable<L>> extends Term<L> {
  final L _atom;
  private TermAtom( L atom ) {
    super(Util.mix_hash(TATOM,atom.hashCode()));
    _atom = atom;
  }
  public static <L extends Comparable<L>> TermAtom<L> make( @NotNull L atom ) {
    return new TermAtom<>(Objects.requireNonNull(atom));
  }

  public L atom() { return _atom; }

  @Override byte tag() { return TATOM; }

  // Leaves have no arguments to rewrite
  @Override Term<L> _apply_args( Term<L> from, Term<L> to ) { return this; }

  @Override boolean _equals_impl( Term<?> t ) { return _atom.equals(((TermAtom<?>)t)._atom); }
  @Override int _compare_impl( Term<L> t ) { return _atom.compareTo(((TermAtom<L>)t)._atom); }

  @Override public SB str( SB sb ) { return sb.pobj(_atom); }
}

package com.cliffc.eq.term;

import com.cliffc.eq.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/** An alias applied to arguments, printed {@code f<x,y>}.  Shaped like a
 *  {@link TermFun}, and unifies with other {@code TermNorm}s the same way,
 *  but can also be expanded through the {@code Normalization} registered
 *  for its symbol in a premise, much like a type alias. */
public final class TermNorm<L extends Comparable<L>> extends TermApp<L> {
  private TermNorm( L sym, Term<L>[] args ) { super(TNORM,sym,args); }

  @SafeVarargs
  public static <L extends Comparable<L>> TermNorm<L> make( @NotNull L sym, Term<L>... args ) {
    return make(sym,List.of(args));
  }
  public static <L extends Comparable<L>> TermNorm<L> make( @NotNull L sym, @NotNull List<? extends Term<L>> args ) {
    return new TermNorm<>(Objects.requireNonNull(sym),copy_args(args));
  }

  @Override byte tag() { return TNORM; }
  @Override TermNorm<L> make_same( Term<L>[] args ) { return new TermNorm<>(_sym,args); }
  @Override public SB str( SB sb ) { return str(sb,'<','>'); }
}

package com.cliffc.eq.term;

import com.cliffc.eq.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/** A function symbol applied to arguments, e.g. {@code f(x,g(y))}.  Equal to
 *  another function term by congruence: same symbol, same arity and
 *  pairwise equal arguments. */
public final class TermFun<L extends Comparable<L>> extends TermApp<L> {
  private TermFun( L sym, Term<L>[] args ) { super(TFUN,sym,args); }

  @SafeVarargs
  public static <L extends Comparable<L>> TermFun<L> make( @NotNull L sym, Term<L>... args ) {
    return make(sym,List.of(args));
  }
  public static <L extends Comparable<L>> TermFun<L> make( @NotNull L sym, @NotNull List<? extends Term<L>> args ) {
    return new TermFun<>(Objects.requireNonNull(sym),copy_args(args));
  }

  @Override byte tag() { return TFUN; }
  @Override TermFun<L> make_same( Term<L>[] args ) { return new TermFun<>(_sym,args); }
  @Override public SB str( SB sb ) { return str(sb,'(',')'); }
}

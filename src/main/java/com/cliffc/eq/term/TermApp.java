package com.cliffc.eq.term;

import com.cliffc.eq.util.SB;
import com.cliffc.eq.util.Util;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** A symbol applied to an ordered list of argument terms.  Shared shape of
 *  {@link TermFun} and {@link TermNorm}; the two never compare equal even
 *  with the same symbol and arguments. */
public abstract class TermApp<L extends Comparable<L>> extends Term<L> {
  final L _sym;                 // Function or alias symbol
  final Term<L>[] _args;        // Arguments, order is significant

  TermApp( byte tag, L sym, Term<L>[] args ) {
    super(hash(tag,sym,args));
    _sym = sym;
    _args = args;
  }
  private static <L extends Comparable<L>> int hash( byte tag, L sym, Term<L>[] args ) {
    int h = Util.mix_hash(tag,sym.hashCode());
    for( Term<L> arg : args ) h = Util.mix_hash(h,arg._hash);
    return h;
  }

  // Defensive copy of host supplied arguments; nulls are not allowed
  @SuppressWarnings("unchecked")
  static <L extends Comparable<L>> Term<L>[] copy_args( List<? extends Term<L>> args ) {
    Term<L>[] as = (Term<L>[])new Term[args.size()];
    for( int i=0; i<as.length; i++ )
      as[i] = Objects.requireNonNull(args.get(i),"null argument");
    return as;
  }

  // Make the same shape with a new argument array; the array is not copied
  abstract TermApp<L> make_same( Term<L>[] args );

  public L sym() { return _sym; }
  @Override public int len() { return _args.length; }
  @Override public Term<L> arg( int i ) { return _args[i]; }
  public List<Term<L>> args() { return List.of(_args); }

  // Rewrite arguments; only allocate if some argument changed
  @Override Term<L> _apply_args( Term<L> from, Term<L> to ) {
    Term<L>[] args = null;
    for( int i=0; i<_args.length; i++ ) {
      Term<L> arg = _args[i].apply(from,to);
      if( arg != _args[i] ) {
        if( args==null ) args = _args.clone();
        args[i] = arg;
      }
    }
    return args==null ? this : make_same(args);
  }

  @Override boolean _equals_impl( Term<?> t ) {
    TermApp<?> app = (TermApp<?>)t;
    return _sym.equals(app._sym) && Arrays.equals(_args,app._args);
  }
  @Override int _compare_impl( Term<L> t ) {
    TermApp<L> app = (TermApp<L>)t;
    int x = _sym.compareTo(app._sym);
    return x!=0 ? x : Util.compare(_args,app._args);
  }

  SB str( SB sb, char open, char close ) {
    sb.pobj(_sym).p(open);
    if( _args.length==0 ) return sb.p(close);
    for( Term<L> arg : _args )
      arg.str(sb).p(',');
    return sb.unchar().p(close);
  }
}

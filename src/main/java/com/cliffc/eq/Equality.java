package com.cliffc.eq;

import com.cliffc.eq.premise.Normalization;
import com.cliffc.eq.premise.Premise;
import com.cliffc.eq.term.Term;
import com.cliffc.eq.term.TermApp;
import com.cliffc.eq.term.TermNorm;
import com.cliffc.eq.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.HashSet;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;

/** Decide if two terms are provably equal under a premise.
 *
 * A depth-first search over four ways of proving {@code t1 = t2}, tried in
 * order after the trivial structural check:
 *
 * - Unification: same shape, symbol and arity, and all arguments pairwise equal.
 * - Normalization: expand an alias on either side and compare the expansion.
 * - Facts: step from either side to a term the premise asserts equal to it.
 * - Bridging: find a premise key that unifies or normalizes with either side,
 *   and step to the facts of that key.
 *
 * Premises may be cyclic (e.g. {@code x = f(x)}), so the search keeps the set
 * of ordered pairs currently being proven.  Meeting a pair already in the set
 * fails that branch.  A pair that gets proven is removed again, so other
 * branches may reuse it; a pair that fails stays in the set until the query
 * ends and is never retried.  This never claims a false equality, but can
 * miss one on some cyclic premises; changing it changes answers.
 *
 * All search state lives in one instance, made per query and thrown away, so
 * concurrent queries against the same read-only premise do not interact.
 */
public final class Equality<L extends Comparable<L>> {
  // Print each search step to stderr, set with -Deq.trace=true
  public static boolean TRACE = Boolean.getBoolean("eq.trace");

  private final Premise<L> _premise;
  // Read-only view of the premise facts, walked once per bridging step
  private final SortedMap<Term<L>,SortedSet<Term<L>>> _eqs;
  // Ordered pairs in progress, or failed
  private final HashSet<Pair<L>> _visit = new HashSet<>();
  private int _depth;           // Recursion depth, for tracing

  private Equality( Premise<L> premise ) {
    _premise = premise;
    _eqs = premise.equalities();
  }

  /** @return true if {@code t1 = t2} is provable from {@code premise}
   *
   *  Total for every premise whose aliases expand finitely.  Expanding an
   *  alias term whose argument contains one of the alias's own parameter
   *  atoms, e.g. {@code 0<10(0)>} under {@code alias 0<0> = 10(0)}, never
   *  finishes (see {@link Term#apply}) and ends in a {@link StackOverflowError}. */
  public static <L extends Comparable<L>> boolean equals( @NotNull Term<L> t1, @NotNull Term<L> t2, @NotNull Premise<L> premise ) {
    if( t1.equals(t2) ) return true; // Skip the setup
    Equality<L> eq = new Equality<>(premise);
    boolean rez = eq.dfs(t1,t2);
    assert eq._depth==0;
    if( EQ.DEBUG ) EQ.p(rez,"equals "+t1+" "+t2+" = "+rez+", "+eq._visit.size()+" pairs marked");
    return rez;
  }

  // -----------------
  private boolean dfs( Term<L> t1, Term<L> t2 ) {
    if( t1.equals(t2) ) return true;
    Pair<L> pair = new Pair<>(t1,t2);
    if( !_visit.add(pair) )     // Been there, done that
      return trace(false,t1,t2,"cycle");
    _depth++;
    boolean rez = _dfs(t1,t2);
    _depth--;
    if( rez ) _visit.remove(pair); // Proven pairs can be reused; failed pairs stay
    return trace(rez,t1,t2,null);
  }

  private boolean _dfs( Term<L> t1, Term<L> t2 ) {
    if( unify    (t1,t2) ) return true;
    if( normalize(t1,t2) ) return true;

    // Step across a fact from either side
    SortedSet<Term<L>> eqs1 = _eqs.get(t1);
    if( eqs1!=null )
      for( Term<L> e : eqs1 )
        if( dfs(e,t2) ) return true;
    SortedSet<Term<L>> eqs2 = _eqs.get(t2);
    if( eqs2!=null )
      for( Term<L> e : eqs2 )
        if( dfs(t1,e) ) return true;

    // Enter the facts through a key that only unifies or normalizes with a side
    for( Map.Entry<Term<L>,SortedSet<Term<L>>> e : _eqs.entrySet() ) {
      Term<L> key = e.getKey();
      SortedSet<Term<L>> vals = e.getValue();
      if( unify    (t1,key) && any_left (vals,t2) ) return true;
      if( unify    (key,t2) && any_right(t1,vals) ) return true;
      if( normalize(t1,key) && any_left (vals,t2) ) return true;
      if( normalize(key,t2) && any_right(t1,vals) ) return true;
    }
    return false;
  }
  private boolean any_left( SortedSet<Term<L>> vals, Term<L> t2 ) {
    for( Term<L> v : vals ) if( dfs(v,t2) ) return true;
    return false;
  }
  private boolean any_right( Term<L> t1, SortedSet<Term<L>> vals ) {
    for( Term<L> v : vals ) if( dfs(t1,v) ) return true;
    return false;
  }

  // Same shape, symbol and arity; then every argument pair must be equal.
  // No other pairing is tried, shape and symbol fix the decomposition.
  private boolean unify( Term<L> t1, Term<L> t2 ) {
    if( !(t1 instanceof TermApp<L> a1) || !(t2 instanceof TermApp<L> a2) ) return false;
    if( a1.getClass() != a2.getClass() ) return false; // TermFun never unifies with TermNorm
    if( !a1.sym().equals(a2.sym()) || a1.len() != a2.len() ) return false;
    for( int i=0; i<a1.len(); i++ )
      if( !dfs(a1.arg(i),a2.arg(i)) )
        return false;
    return true;
  }

  // Expand an alias on the left and compare; failing that, on the right.
  private boolean normalize( Term<L> t1, Term<L> t2 ) {
    Term<L> x1 = expand(t1);
    if( x1!=null && dfs(x1,t2) ) return true;
    Term<L> x2 = expand(t2);
    return x2!=null && dfs(t1,x2);
  }
  // Expansion of an alias term, or null if not an alias, no alias is
  // registered, or the arity does not match.
  private Term<L> expand( Term<L> t ) {
    if( !(t instanceof TermNorm<L> n) ) return null;
    Normalization<L> norm = _premise.get_normalization(n.sym());
    return norm==null ? null : norm.expand(n.args());
  }

  private boolean trace( boolean rez, Term<L> t1, Term<L> t2, String why ) {
    if( !TRACE ) return rez;
    SB sb = new SB().i(_depth);
    t2.str(t1.str(sb).p(rez ? " == " : " != "));
    if( why!=null ) sb.p(" (").p(why).p(')');
    System.err.println(sb);
    return rez;
  }

  // An ordered pair of terms; (a,b) and (b,a) are different pairs
  private static final class Pair<L extends Comparable<L>> {
    final Term<L> _t1, _t2;
    final int _hash;
    Pair( Term<L> t1, Term<L> t2 ) { _t1=t1; _t2=t2; _hash = t1.hashCode()*31 + t2.hashCode(); }
    @Override public int hashCode() { return _hash; }
    @Override public boolean equals( Object o ) {
      if( this==o ) return true;
      if( !(o instanceof Pair) ) return false;
      Pair<?> p = (Pair<?>)o;
      return _hash==p._hash && _t1.equals(p._t1) && _t2.equals(p._t2);
    }
  }
}

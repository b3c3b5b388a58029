package com.cliffc.eq.premise;

import com.cliffc.eq.EQ;
import com.cliffc.eq.term.Term;
import com.cliffc.eq.util.SB;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/** A premise: the background facts an equality query is decided under.
 *
 * Two independent tables:
 *
 * - Equalities, from a term to the set of terms asserted equal to it.  Always
 *   symmetric; {@link #insert} is the only way in and adds both directions.
 *   Not transitively closed, chasing chains of facts is the search's job.
 *   For example the facts {@code x=y, x=z} are kept as
 *   {@code x:{y,z}, y:{x}, z:{x}}.
 *
 * - Normalizations, from an alias symbol to its {@link Normalization}.  First
 *   registration wins; later ones for the same symbol are refused.
 *
 * Both tables are sorted by the term and atom orderings, so iteration (and
 * hence the search) is deterministic.  A premise is built up front and then
 * only read; sharing a premise between concurrent queries is safe as long as
 * nobody inserts into it meanwhile.
 */
public class Premise<L extends Comparable<L>> {
  private final TreeMap<Term<L>,TreeSet<Term<L>>> _eqs;
  // Same keys as _eqs, each set wrapped read-only once when first made
  private final TreeMap<Term<L>,SortedSet<Term<L>>> _ros = new TreeMap<>();
  private final SortedMap<Term<L>,SortedSet<Term<L>>> _view = Collections.unmodifiableSortedMap(_ros);
  private final TreeMap<L,Normalization<L>> _norms;

  public Premise() { this(new TreeMap<>(), new TreeMap<>()); }
  private Premise( TreeMap<Term<L>,TreeSet<Term<L>>> eqs, TreeMap<L,Normalization<L>> norms ) {
    _eqs = eqs;
    _norms = norms;
    for( Map.Entry<Term<L>,TreeSet<Term<L>>> e : eqs.entrySet() )
      _ros.put(e.getKey(),Collections.unmodifiableSortedSet(e.getValue()));
  }

  /** A premise holding the given equalities, each pair inserted in order. */
  public static <L extends Comparable<L>> Premise<L> make( @NotNull Iterable<? extends Map.Entry<? extends Term<L>,? extends Term<L>>> pairs ) {
    Premise<L> p = new Premise<>();
    for( Map.Entry<? extends Term<L>,? extends Term<L>> pair : pairs )
      p.insert(pair.getKey(),pair.getValue());
    return p;
  }

  /** Read-only live view of the equalities table, in term order.  Later
   *  inserts show through; no copy is made. */
  public SortedMap<Term<L>,SortedSet<Term<L>>> equalities() { return _view; }

  /** Terms asserted equal to {@code t}, or null if there are none. */
  public @Nullable SortedSet<Term<L>> get( @NotNull Term<L> t ) { return _ros.get(t); }

  /** Assert {@code t0 = t1}, in both directions. */
  public void insert( @NotNull Term<L> t0, @NotNull Term<L> t1 ) {
    Objects.requireNonNull(t0);
    Objects.requireNonNull(t1);
    set(t0).add(t1);
    set(t1).add(t0);
    assert symmetric();
  }
  private TreeSet<Term<L>> set( Term<L> t ) {
    TreeSet<Term<L>> s = _eqs.get(t);
    if( s==null ) {
      _eqs.put(t,s = new TreeSet<>());
      _ros.put(t,Collections.unmodifiableSortedSet(s));
    }
    return s;
  }

  /** The alias registered for a symbol, or null. */
  public @Nullable Normalization<L> get_normalization( @NotNull L sym ) { return _norms.get(sym); }

  /** Register an alias {@code sym<params> = equiv}.
   *  @return true if registered, false if {@code sym} already has an alias;
   *  the existing alias is left untouched. */
  public boolean insert_normalization( @NotNull L sym, @NotNull List<L> params, @NotNull Term<L> equiv ) {
    Objects.requireNonNull(sym);
    if( _norms.containsKey(sym) )
      return EQ.p(false,"Alias "+sym+" already defined, ignoring "+equiv);
    _norms.put(sym,new Normalization<>(params,equiv));
    return true;
  }

  /** An independent copy; further inserts into either do not show in the other. */
  public Premise<L> copy() {
    TreeMap<Term<L>,TreeSet<Term<L>>> eqs = new TreeMap<>();
    for( Map.Entry<Term<L>,TreeSet<Term<L>>> e : _eqs.entrySet() )
      eqs.put(e.getKey(),new TreeSet<>(e.getValue()));
    return new Premise<>(eqs,new TreeMap<>(_norms));
  }

  // Every fact is recorded in both directions
  boolean symmetric() {
    for( Map.Entry<Term<L>,TreeSet<Term<L>>> e : _eqs.entrySet() )
      for( Term<L> t : e.getValue() ) {
        TreeSet<Term<L>> back = _eqs.get(t);
        if( back==null || !back.contains(e.getKey()) )
          return false;
      }
    return true;
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Premise) ) return false;
    Premise<?> p = (Premise<?>)o;
    return _eqs.equals(p._eqs) && _norms.equals(p._norms);
  }
  @Override public int hashCode() { return _eqs.hashCode()*31 + _norms.hashCode(); }

  @Override public String toString() { return str(new SB()).toString(); }
  public SB str( SB sb ) {
    sb.p("Premise {").nl().ii(1);
    for( Map.Entry<Term<L>,TreeSet<Term<L>>> e : _eqs.entrySet() ) {
      e.getKey().str(sb.i()).p(" = {");
      for( Term<L> t : e.getValue() ) t.str(sb).p(',');
      sb.unchar().p('}').nl();
    }
    for( Map.Entry<L,Normalization<L>> e : _norms.entrySet() )
      e.getValue().str(sb.i().p("alias ").pobj(e.getKey())).nl();
    return sb.di(1).p('}');
  }
}

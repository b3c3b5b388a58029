package com.cliffc.eq.premise;

import com.cliffc.eq.term.Term;
import com.cliffc.eq.term.TermAtom;
import com.cliffc.eq.term.TermFun;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.junit.Assert.*;

public class TestPremise {
  private static TermAtom<Integer> a( int x ) { return TermAtom.make(x); }
  @SafeVarargs private static TermFun<Integer> f( int sym, Term<Integer>... args ) { return TermFun.make(sym,args); }

  @Test public void testInsertSymmetric() {
    Premise<Integer> p = new Premise<>();
    p.insert(a(1),a(2));
    p.insert(a(1),f(3,a(4)));
    SortedMap<Term<Integer>,SortedSet<Term<Integer>>> eqs = p.equalities();
    assertEquals(3,eqs.size());
    assertEquals(new TreeSet<>(List.of(a(2),f(3,a(4)))),eqs.get(a(1)));
    assertEquals(new TreeSet<>(List.of(a(1))),eqs.get(a(2)));
    assertEquals(new TreeSet<>(List.of(a(1))),eqs.get(f(3,a(4))));
    assertTrue(p.symmetric());
    // Not transitively closed
    assertFalse(p.get(a(2)).contains(f(3,a(4))));
    assertNull(p.get(a(9)));
    // Keys in term order
    assertEquals(a(1),eqs.firstKey());
    assertEquals(f(3,a(4)),eqs.lastKey());
  }

  @Test public void testInsertSelf() {
    Premise<Integer> p = new Premise<>();
    p.insert(a(1),a(1));
    assertEquals(1,p.equalities().size());
    assertEquals(1,p.get(a(1)).size());
    assertTrue(p.symmetric());
  }

  @Test public void testReadOnly() {
    Premise<Integer> p = new Premise<>();
    p.insert(a(1),a(2));
    assertThrows(UnsupportedOperationException.class, () -> p.equalities().clear());
    assertThrows(UnsupportedOperationException.class, () -> p.equalities().get(a(1)).add(a(3)));
    assertThrows(UnsupportedOperationException.class, () -> p.get(a(1)).clear());
    assertTrue(p.symmetric());
    // One live view, not a copy per call
    SortedMap<Term<Integer>,SortedSet<Term<Integer>>> eqs = p.equalities();
    assertSame(eqs,p.equalities());
    SortedSet<Term<Integer>> s1 = p.get(a(1));
    p.insert(a(1),a(3));
    assertEquals(3,eqs.size());
    assertTrue(eqs.get(a(1)).contains(a(3)));
    assertTrue(s1.contains(a(3)));
    assertSame(eqs.get(a(3)),p.get(a(3)));
  }

  @Test public void testMake() {
    Premise<Integer> p = Premise.make(List.of(Map.entry(a(0),a(1)),Map.entry(a(1),a(2))));
    Premise<Integer> q = new Premise<>();
    q.insert(a(0),a(1));
    q.insert(a(1),a(2));
    assertEquals(q,p);
    assertEquals(q.hashCode(),p.hashCode());
    assertEquals(2,p.get(a(1)).size());
  }

  @Test public void testNormalizationFirstWins() {
    Premise<Integer> p = new Premise<>();
    assertNull(p.get_normalization(5));
    assertTrue (p.insert_normalization(5,List.of(1),f(6,a(1))));
    assertFalse(p.insert_normalization(5,List.of(2),f(7,a(2))));
    Normalization<Integer> n = p.get_normalization(5);
    assertEquals(List.of(1),n.params());
    assertEquals(f(6,a(1)),n.equivalence());
    // Aliases do not touch the equalities
    assertTrue(p.equalities().isEmpty());
  }

  @Test public void testExpand() {
    Premise<Integer> p = new Premise<>();
    p.insert_normalization(5,List.of(1,2),f(6,a(1),f(7,a(2))));
    Normalization<Integer> n = p.get_normalization(5);
    assertEquals(f(6,a(3),f(7,a(4))),n.expand(List.of(a(3),a(4))));
    // Arity mismatch is not an error, just no expansion
    assertNull(n.expand(List.of(a(3))));
    assertNull(n.expand(List.of(a(3),a(4),a(5))));
    // Definition unchanged by expanding
    assertEquals(f(6,a(1),f(7,a(2))),n.equivalence());
  }

  // Parameters are substituted one at a time, first to last, into the
  // partially rewritten tree.  The first argument mentions the second
  // parameter, so the second substitution rewrites it as well.
  // An argument holding its own parameter atom is rewritten again and again
  @Test public void testExpandSelfArgument() {
    Premise<Integer> p = new Premise<>();
    p.insert_normalization(0,List.of(0),f(10,a(0)));
    Normalization<Integer> n = p.get_normalization(0);
    assertEquals(f(10,f(10,a(1))),n.expand(List.of(f(10,a(1)))));
    assertThrows(StackOverflowError.class, () -> n.expand(List.of(f(10,a(0)))));
  }

  @Test public void testExpandOrder() {
    Premise<Integer> p = new Premise<>();
    p.insert_normalization(5,List.of(1,2),f(6,a(1),a(2)));
    Normalization<Integer> n = p.get_normalization(5);
    assertEquals(f(6,a(3),a(3)),n.expand(List.of(a(2),a(3))));
    assertEquals(f(6,f(8,a(3)),a(3)),n.expand(List.of(f(8,a(2)),a(3))));
    // Swapped parameters collapse onto the second argument
    assertEquals(f(6,a(1),a(1)),n.expand(List.of(a(2),a(1))));
  }

  @Test public void testExpandNoParams() {
    Premise<Integer> p = new Premise<>();
    p.insert_normalization(5,List.of(),f(6,a(1)));
    assertEquals(f(6,a(1)),p.get_normalization(5).expand(List.of()));
    assertNull(p.get_normalization(5).expand(List.of(a(1))));
  }

  @Test public void testCopy() {
    Premise<Integer> p = new Premise<>();
    p.insert(a(1),a(2));
    p.insert_normalization(5,List.of(1),a(1));
    Premise<Integer> q = p.copy();
    assertEquals(p,q);
    q.insert(a(1),a(3));
    q.insert_normalization(6,List.of(),a(1));
    assertNotEquals(p,q);
    assertEquals(1,p.get(a(1)).size());
    assertNull(p.get_normalization(6));
    assertEquals(2,q.get(a(1)).size());
  }

  @Test public void testStr() {
    Premise<Integer> p = new Premise<>();
    p.insert(a(1),f(2,a(3)));
    p.insert_normalization(5,List.of(1,2),f(6,a(1),a(2)));
    assertEquals("<1,2> = 6(1,2)",p.get_normalization(5).toString());
    String s = p.toString();
    assertTrue(s, s.contains("1 = {2(3)}"));
    assertTrue(s, s.contains("2(3) = {1}"));
    assertTrue(s, s.contains("alias 5<1,2> = 6(1,2)"));
  }
}

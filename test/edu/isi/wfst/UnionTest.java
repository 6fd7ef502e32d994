package edu.isi.wfst;

import static edu.isi.wfst.FstFixtures.arc;
import static edu.isi.wfst.FstFixtures.canonical;
import static edu.isi.wfst.FstFixtures.fst;
import static edu.isi.wfst.FstFixtures.paths;
import static edu.isi.wfst.FstFixtures.string;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

import org.junit.Test;

public class UnionTest {

	private final Semiring trop = new TropicalSemiring();

	// 0 -1-> 1, state 1 final 0.5
	private VectorFst left() {
		VectorFst a = fst(trop, 2, 0);
		arc(a, 0, 1, 1, 0, 1);
		a.setFinal(1, 0.5);
		return a;
	}

	// one state, start and final 0.25
	private VectorFst right() {
		VectorFst b = fst(trop, 1, 0);
		b.setFinal(0, 0.25);
		return b;
	}

	@Test
	public void epsilonFromUnreenterableStart() {
		VectorFst a = left();
		Union.union(a, right());
		assertEquals(3, a.getNumStates());
		assertEquals(0, a.getStart());
		assertEquals(2, a.getNumArcs(0));
		assertEquals(new Arc(Arc.EPSILON, Arc.EPSILON, trop.ONE(), 2), a.getArcs(0).get(1));
		assertEquals(0.25, a.getFinal(2), 0);
		assertEquals(0.5, a.getFinal(1), 0);
		Map<String, Double> expected = new TreeMap<String, Double>();
		expected.put("", 0.25);
		expected.put("1", 0.5);
		assertEquals(expected, paths(a));
		assertFalse(a.hasError());
	}

	@Test
	public void newStartWhenStartIsReentered() {
		VectorFst a = left();
		arc(a, 1, 2, 2, 0, 0);
		Union.union(a, right());
		// two, plus one, plus the new start state
		assertEquals(4, a.getNumStates());
		assertEquals(3, a.getStart());
		assertEquals(2, a.getNumArcs(3));
		assertEquals(0, a.getArcs(3).get(0).getNextState());
		assertEquals(2, a.getArcs(3).get(1).getNextState());
		assertTrue(trop.isZero(a.getFinal(3)));
	}

	@Test
	public void stateIdsOfSecondAreShifted() {
		VectorFst a = left();
		VectorFst b = fst(trop, 3, 1);
		arc(b, 1, 4, 4, 1.0, 2);
		arc(b, 2, 5, 5, 0, 0);
		b.setFinal(0, 0);
		Union.union(a, b);
		assertEquals(5, a.getNumStates());
		assertEquals(new Arc(4, 4, 1.0, 4), a.getArcs(3).get(0));
		assertEquals(new Arc(5, 5, 0, 2), a.getArcs(4).get(0));
		assertEquals(new Arc(Arc.EPSILON, Arc.EPSILON, trop.ONE(), 3), a.getArcs(0).get(1));
		assertEquals(0, a.getFinal(2), 0);
	}

	@Test
	public void emptyLeftBecomesRight() {
		VectorFst a = new VectorFst(trop);
		VectorFst b = left();
		Union.union(a, b);
		assertEquals(canonical(b), canonical(a));
		assertEquals(2, a.getNumStates());
		assertEquals(0, a.getStart());
		assertEquals(b.getProperties(Properties.COPY_PROPERTIES, false), a.getProperties(Properties.COPY_PROPERTIES, false));
	}

	@Test
	public void leftWithoutStartKeepsDeadStates() {
		VectorFst a = fst(trop, 2, Fst.NO_STATE);
		VectorFst b = left();
		Union.union(a, b);
		assertEquals(4, a.getNumStates());
		assertEquals(2, a.getStart());
		assertEquals(canonical(b), canonical(a));
		assertTrue(a.getProperties(Properties.NOT_ACCESSIBLE, false) != 0);
	}

	@Test
	public void emptyRightChangesNothing() {
		VectorFst a = left();
		Union.union(a, new VectorFst(trop));
		assertEquals(canonical(left()), canonical(a));
		assertEquals(2, a.getNumStates());
	}

	@Test
	public void mismatchedSymbolsAreAnError() {
		VectorFst a = left();
		SymbolTable s1 = new SymbolTable("one");
		s1.addSymbol("<eps>");
		s1.addSymbol("a");
		a.setInputSymbols(s1);
		VectorFst b = right();
		SymbolTable s2 = new SymbolTable("two");
		s2.addSymbol("<eps>");
		s2.addSymbol("b");
		b.setInputSymbols(s2);
		Union.union(a, b);
		assertTrue(a.hasError());
		assertEquals(2, a.getNumStates());
	}

	@Test
	public void mismatchedSemiringsAreAnError() {
		VectorFst a = left();
		VectorFst b = fst(new RealSemiring(), 1, 0);
		Union.union(a, b);
		assertTrue(a.hasError());
	}

	@Test
	public void unionOfMany() {
		VectorFst a = string(trop, 1.0, 1, 2);
		Union.union(a, Arrays.asList(string(trop, 2.0, 3), string(trop, 0.5, 1, 2), right()));
		Map<String, Double> expected = new TreeMap<String, Double>();
		expected.put("1 2", 0.5);
		expected.put("3", 2.0);
		expected.put("", 0.25);
		assertEquals(expected, paths(a));
	}

	@Test
	public void lazyAgreesWithEager() {
		VectorFst eager = left();
		Union.union(eager, string(trop, 2.0, 3, 4));
		UnionFst lazy = new UnionFst(left(), string(trop, 2.0, 3, 4));
		assertEquals(paths(eager), paths(lazy));
		assertEquals(0, lazy.getStart());
		assertEquals(2, lazy.getNumArcs(0));
		assertEquals(2, lazy.getNumInputEpsilons(0));
		assertTrue(trop.isZero(lazy.getFinal(0)));
		assertEquals(Fst.countStates(left()) + 3 + 1, Fst.countStates(lazy));
		assertFalse(lazy.hasError());
	}

	@Test
	public void lazyTermsCanBeAddedUntilStartIsExpanded() {
		UnionFst lazy = new UnionFst(left(), right());
		Union.union(lazy, string(trop, 2.0, 3));
		assertEquals(3, lazy.getNumTerms());
		assertEquals(3, lazy.getNumArcs(0));
		assertFalse(lazy.hasError());
		lazy.addUnion(string(trop, 1.0, 4));
		assertTrue(lazy.hasError());
		assertEquals(3, lazy.getNumTerms());
	}

	@Test
	public void lazyCopies() {
		UnionFst lazy = new UnionFst(left(), right());
		UnionFst shared = lazy.copy(false);
		shared.addUnion(string(trop, 2.0, 3));
		assertEquals(3, lazy.getNumTerms());
		UnionFst safe = lazy.copy(true);
		assertEquals(canonical(lazy), canonical(safe));
		// the safe copy has its own cache, so it can still take terms
		UnionFst fresh = new UnionFst(left(), right()).copy(true);
		fresh.addUnion(string(trop, 2.0, 3));
		assertFalse(fresh.hasError());
	}

	@Test
	public void lazyUnionClaimsEpsilonsOnlyWithConnectingArcs() {
		long eps = Properties.EPSILONS | Properties.NO_EPSILONS;
		UnionFst startless = new UnionFst(fst(trop, 1, Fst.NO_STATE), fst(trop, 2, Fst.NO_STATE));
		assertEquals(0, startless.getProperties(Properties.EPSILONS, false));
		assertEquals(0, startless.getNumArcs(0));
		assertTrue(Properties.compatProperties(startless.getProperties(eps, false), PropertyComputer.compute(startless) & eps));
		assertEquals(Properties.NO_EPSILONS, startless.getProperties(eps, true));
		UnionFst lazy = new UnionFst(fst(trop, 1, Fst.NO_STATE), right());
		assertEquals(Properties.EPSILONS, lazy.getProperties(Properties.EPSILONS, false));
		assertEquals(1, lazy.getNumInputEpsilons(0));
	}

	@Test
	public void lazyMismatchedTermIsAnError() {
		UnionFst lazy = new UnionFst(left(), fst(new RealSemiring(), 1, 0));
		assertTrue(lazy.hasError());
		assertEquals(1, lazy.getNumTerms());
	}
}

package edu.isi.wfst;

import static edu.isi.wfst.FstFixtures.arc;
import static edu.isi.wfst.FstFixtures.canonical;
import static edu.isi.wfst.FstFixtures.fst;
import static edu.isi.wfst.FstFixtures.paths;
import static edu.isi.wfst.FstFixtures.string;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.junit.Test;

public class IntersectTest {

	private final Semiring trop = new TropicalSemiring();

	// accepts "1 2" (1.0) and "1 3" (2.0)
	private VectorFst twoStrings() {
		VectorFst a = fst(trop, 3, 0);
		arc(a, 0, 1, 1, 1.0, 1);
		arc(a, 1, 2, 2, 0, 2);
		arc(a, 1, 3, 3, 1.0, 2);
		a.setFinal(2, 0);
		return a;
	}

	// 0 -1/0.5-> 1 -eps/0.25-> 2 -2/1.0-> 3
	private VectorFst withEpsilon() {
		VectorFst a = fst(trop, 4, 0);
		arc(a, 0, 1, 1, 0.5, 1);
		arc(a, 1, 0, 0, 0.25, 2);
		arc(a, 2, 2, 2, 1.0, 3);
		a.setFinal(3, 0);
		return a;
	}

	// 0 -1/0.5-> 1, then -2/0.5-> final 0.25 or -3-> final
	private VectorFst branching() {
		VectorFst b = fst(trop, 4, 0);
		arc(b, 0, 1, 1, 0.5, 1);
		arc(b, 1, 2, 2, 0.5, 2);
		arc(b, 1, 3, 3, 0, 3);
		b.setFinal(2, 0.25);
		b.setFinal(3, 0);
		return b;
	}

	private static Map<String, Double> single(String s, double w) {
		Map<String, Double> m = new TreeMap<String, Double>();
		m.put(s, w);
		return m;
	}

	@Test
	public void weightsMultiplyOnSharedStrings() {
		for (FilterType ft : FilterType.values()) {
			VectorFst out = new VectorFst(trop);
			Intersect.intersect(twoStrings(), string(trop, 0.5, 1, 2), out, new IntersectOptions(true, ft));
			assertEquals(ft.toString(), single("1 2", 1.5), paths(out));
			assertFalse(ft.toString(), out.hasError());
		}
	}

	@Test
	public void epsilonsFollowedOnce() {
		for (FilterType ft : FilterType.values()) {
			VectorFst out = new VectorFst(trop);
			Intersect.intersect(withEpsilon(), branching(), out, new IntersectOptions(true, ft));
			if (ft == FilterType.NULL) {
				// an epsilon can only pair with an epsilon, and there are none on the other side
				assertEquals(ft.toString(), Collections.<String, Double>emptyMap(), paths(out));
				assertEquals(0, out.getNumStates());
			}
			else
				assertEquals(ft.toString(), single("1 2", 3.0), paths(out));
		}
	}

	@Test
	public void epsilonsOnBothSides() {
		VectorFst b = fst(trop, 4, 0);
		arc(b, 0, 1, 1, 0.5, 1);
		arc(b, 1, 0, 0, 1.0, 2);
		arc(b, 2, 2, 2, 0, 3);
		b.setFinal(3, 0);
		FilterType[] counted = { FilterType.SEQUENCE, FilterType.ALT_SEQUENCE, FilterType.MATCH, FilterType.AUTO };
		for (FilterType ft : counted) {
			VectorFst out = new VectorFst(trop);
			Intersect.intersect(withEpsilon(), b, out, new IntersectOptions(true, ft));
			// 0.5+0.25+1.0 on one side, 0.5+1.0 on the other
			assertEquals(ft.toString(), single("1 2", 3.25), paths(out));
		}
	}

	@Test
	public void lazyAgreesWithEager() {
		VectorFst eager = new VectorFst(trop);
		Intersect.intersect(withEpsilon(), branching(), eager, new IntersectOptions(false, FilterType.SEQUENCE));
		IntersectFst lazy = new IntersectFst(withEpsilon(), branching());
		assertEquals(canonical(eager), canonical(lazy));
		assertEquals(eager.getNumStates(), Fst.countStates(lazy));
		assertEquals(FilterType.AUTO, lazy.getFilterType());
		assertEquals("(0, 0, 0)", lazy.describeState(lazy.getStart()));
		IntersectFst safe = lazy.copy(true);
		assertEquals(canonical(lazy), canonical(safe));
		IntersectFst shared = lazy.copy(false);
		assertEquals(lazy.getNumArcs(0), shared.getNumArcs(0));
	}

	@Test
	public void connectDropsDeadStates() {
		// 0 -1-> 1 -2-> 3 and 0 -1-> 2 -4-> 3
		VectorFst a = fst(trop, 4, 0);
		arc(a, 0, 1, 1, 0, 1);
		arc(a, 0, 1, 1, 0, 2);
		arc(a, 1, 2, 2, 0, 3);
		arc(a, 2, 4, 4, 0, 3);
		a.setFinal(3, 0);
		VectorFst b = string(trop, 0, 1, 2);
		VectorFst unconnected = new VectorFst(trop);
		Intersect.intersect(a, b, unconnected, new IntersectOptions(false, FilterType.AUTO));
		assertEquals(4, unconnected.getNumStates());
		VectorFst connected = new VectorFst(trop);
		Intersect.intersect(a, b, connected);
		assertEquals(3, connected.getNumStates());
		assertEquals(paths(unconnected), paths(connected));
		assertTrue(connected.getProperties(Properties.CO_ACCESSIBLE, false) != 0);
	}

	@Test
	public void transducersAreAnError() {
		VectorFst a = fst(trop, 2, 0);
		arc(a, 0, 1, 2, 0, 1);
		a.setFinal(1, 0);
		IntersectFst lazy = new IntersectFst(a, string(trop, 0, 1));
		assertTrue(lazy.hasError());
		VectorFst out = new VectorFst(trop);
		Intersect.intersect(string(trop, 0, 1), a, out);
		assertTrue(out.hasError());
	}

	@Test
	public void mismatchedSemiringsAreAnError() {
		IntersectFst lazy = new IntersectFst(string(trop, 0, 1), string(new RealSemiring(), 0, 1));
		assertTrue(lazy.hasError());
	}

	@Test
	public void composeMatchesOutputsToInputs() {
		VectorFst a = fst(trop, 2, 0);
		arc(a, 0, 1, 2, 0.5, 1);
		a.setFinal(1, 0);
		VectorFst b = fst(trop, 2, 0);
		arc(b, 0, 2, 3, 0.25, 1);
		b.setFinal(1, 0.25);
		ComposeFst c = new ComposeFst(a, b);
		assertEquals(1, c.getNumArcs(c.getStart()));
		Arc arc = c.getArcs(c.getStart()).get(0);
		assertEquals(new Arc(1, 3, 0.75, arc.getNextState()), arc);
		assertEquals(0.25, c.getFinal(arc.getNextState()), 0);
		assertFalse(c.hasError());
	}

	private static final long EPSILON_BITS = Properties.EPSILONS | Properties.NO_EPSILONS |
		Properties.I_EPSILONS | Properties.NO_I_EPSILONS | Properties.O_EPSILONS | Properties.NO_O_EPSILONS;

	@Test
	public void composeEpsilonBitsMatchItsArcs() {
		// 1:2 against 0:3 then 2:4; the second moves alone first
		VectorFst a = fst(trop, 2, 0);
		arc(a, 0, 1, 2, 0, 1);
		a.setFinal(1, 0);
		VectorFst b = fst(trop, 3, 0);
		arc(b, 0, 0, 3, 0, 1);
		arc(b, 1, 2, 4, 0, 2);
		b.setFinal(2, 0);
		ComposeFst c = new ComposeFst(a, b);
		assertEquals(0, c.getProperties(Properties.NO_I_EPSILONS, false));
		assertTrue(Properties.compatProperties(c.getProperties(EPSILON_BITS, false), PropertyComputer.compute(c) & EPSILON_BITS));
		assertEquals(Properties.I_EPSILONS, c.getProperties(Properties.I_EPSILONS, true));

		// 1:0 against 3:4; the first moves alone first
		VectorFst d = fst(trop, 3, 0);
		arc(d, 0, 1, 0, 0, 1);
		arc(d, 1, 2, 3, 0, 2);
		d.setFinal(2, 0);
		VectorFst e = fst(trop, 2, 0);
		arc(e, 0, 3, 4, 0, 1);
		e.setFinal(1, 0);
		ComposeFst f = new ComposeFst(d, e);
		assertEquals(0, f.getProperties(Properties.NO_O_EPSILONS, false));
		assertTrue(Properties.compatProperties(f.getProperties(EPSILON_BITS, false), PropertyComputer.compute(f) & EPSILON_BITS));
		assertEquals(Properties.O_EPSILONS, f.getProperties(Properties.O_EPSILONS, true));
	}

	@Test
	public void emptyOperandGivesEmptyResult() {
		IntersectFst lazy = new IntersectFst(new VectorFst(trop), string(trop, 0, 1));
		assertEquals(Fst.NO_STATE, lazy.getStart());
		assertEquals(0, Fst.countStates(lazy));
		VectorFst out = new VectorFst(trop);
		Intersect.intersect(string(trop, 0, 1), new VectorFst(trop), out);
		assertEquals(0, out.getNumStates());
		assertEquals(Fst.NO_STATE, out.getStart());
	}

	@Test
	public void filterTypesByName() throws ConfigureException {
		assertEquals(FilterType.ALT_SEQUENCE, FilterType.get("alt_sequence"));
		assertEquals(FilterType.MATCH, FilterType.get("Match"));
		assertTrue(FilterType.getList().contains("no_match"));
		try {
			FilterType.get("lookahead");
			fail("unknown filter type accepted");
		}
		catch (ConfigureException e) {
			assertTrue(e.getMessage().contains("lookahead"));
		}
	}

	@Test
	public void optionsDefaults() {
		IntersectOptions o = new IntersectOptions();
		assertTrue(o.isConnect());
		assertEquals(FilterType.AUTO, o.getFilterType());
	}
}

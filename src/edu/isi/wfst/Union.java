package edu.isi.wfst;

import java.util.List;

/**
 * Rational union: the result accepts a path of either operand. The eager
 * forms append the second automaton's states to the first.
 */
public class Union {

	/**
	 * fst1 becomes the union of fst1 and fst2. fst2's state s becomes state
	 * n1+s, where n1 is fst1's state count beforehand. If fst1's start state can't
	 * be re-entered it gets an epsilon arc to fst2's start state; otherwise a new
	 * start state with epsilon arcs to both is added.
	 */
	public static void union(MutableFst fst1, Fst fst2) {
		boolean debug = false;
		if (!SymbolTable.compatSymbols(fst1.getInputSymbols(), fst2.getInputSymbols()) ||
				!SymbolTable.compatSymbols(fst1.getOutputSymbols(), fst2.getOutputSymbols())) {
			fst1.setError("Union: symbol tables of the second argument don't match the first's");
			return;
		}
		if (!fst1.getSemiring().sameAs(fst2.getSemiring())) {
			fst1.setError("Union: can't add "+fst2.getSemiring().getName()+" fst to "+
					fst1.getSemiring().getName()+" fst");
			return;
		}
		Semiring semiring = fst1.getSemiring();
		int numstates1 = fst1.getNumStates();
		boolean initialAcyclic1 = fst1.getProperties(Properties.INITIAL_ACYCLIC, true) == Properties.INITIAL_ACYCLIC;
		long props1 = fst1.getProperties(Properties.FST_PROPERTIES, false);
		long props2 = fst2.getProperties(Properties.FST_PROPERTIES, false);
		int start2 = fst2.getStart();
		if (start2 == Fst.NO_STATE) {
			if ((props2 & Properties.ERROR) != 0)
				fst1.setProperties(Properties.ERROR, Properties.ERROR);
			return;
		}
		int numstates2 = fst2.getNumStatesIfKnown();
		if (numstates2 != Fst.UNKNOWN_STATE_COUNT)
			fst1.reserveStates(numstates1 + numstates2 + (initialAcyclic1 ? 0 : 1));
		StateIterator sit = fst2.getStates();
		while (sit.hasNext()) {
			int s2 = sit.next();
			int s1 = numstates1 + s2;
			while (fst1.getNumStates() <= s1)
				fst1.addState();
			fst1.setFinal(s1, fst2.getFinal(s2));
			List<Arc> arcs = fst2.getArcs(s2);
			fst1.reserveArcs(s1, arcs.size());
			for (Arc a : arcs) {
				int next = numstates1 + a.getNextState();
				while (fst1.getNumStates() <= next)
					fst1.addState();
				fst1.addArc(s1, a.withNextState(next));
			}
		}
		int start1 = fst1.getStart();
		// states fst1 had without a start state are dead, so only fst2 is left
		if (start1 == Fst.NO_STATE) {
			fst1.setStart(start2 + numstates1);
			long props = props2;
			if (numstates1 > 0)
				props = (props2 & ~(Properties.ACCESSIBLE | Properties.CO_ACCESSIBLE |
						Properties.NOT_CO_ACCESSIBLE | Properties.STRING)) | Properties.NOT_ACCESSIBLE;
			fst1.setProperties(props, Properties.COPY_PROPERTIES);
			return;
		}
		if (initialAcyclic1)
			fst1.addArc(start1, new Arc(Arc.EPSILON, Arc.EPSILON, semiring.ONE(), start2 + numstates1));
		else {
			int nstart1 = fst1.addState();
			fst1.setStart(nstart1);
			fst1.addArc(nstart1, new Arc(Arc.EPSILON, Arc.EPSILON, semiring.ONE(), start1));
			fst1.addArc(nstart1, new Arc(Arc.EPSILON, Arc.EPSILON, semiring.ONE(), start2 + numstates1));
			if (debug) Debug.debug(debug, "New start state "+nstart1);
		}
		fst1.setProperties(Properties.unionProperties(props1, props2, false), Properties.FST_PROPERTIES);
	}

	// union of fst1 with every automaton in fsts2, in order
	public static void union(MutableFst fst1, List<? extends Fst> fsts2) {
		fst1.reserveStates(1 + fst1.getNumStates() + Fst.countStates(fsts2));
		for (Fst f : fsts2)
			union(fst1, f);
	}

	// add another term to a lazy union
	public static void union(UnionFst fst1, Fst fst2) {
		fst1.addUnion(fst2);
	}
}

package edu.isi.wfst;

import java.util.List;

// the read side of a weighted automaton. This is all that the algorithms need
// from storage: a start state, final weights, arcs out of each state, and the
// property bits. The state count may be unknown until all states are visited.
//
// Nothing here throws on a bad automaton. Problems show up as the ERROR property.
public abstract class Fst {

	// "no state": no start state, or the destination of a final-weight arc
	public static final int NO_STATE = -1;
	// returned by getNumStatesIfKnown when the count isn't known
	public static final int UNKNOWN_STATE_COUNT = -1;

	// start state, or NO_STATE for an empty automaton
	public abstract int getStart();
	// final weight of s; ZERO() of the semiring means not final
	public abstract double getFinal(int s);
	// arcs leaving s in storage order. The list must not be modified
	public abstract List<Arc> getArcs(int s);
	public abstract StateIterator getStates();
	public abstract Semiring getSemiring();
	public abstract SymbolTable getInputSymbols();
	public abstract SymbolTable getOutputSymbols();
	// short name of the implementation
	public abstract String getType();

	/**
	 * Copy this automaton. A copy with safe false may share state (caches, the
	 * source automaton, mappers) with this one, so the two must only be read from
	 * one thread at a time. A safe copy shares nothing mutable and can be
	 * traversed concurrently with the original.
	 */
	public abstract Fst copy(boolean safe);

	// stored properties for the bits in mask, refreshing anything (like ERROR) that
	// can be found without a traversal
	protected abstract long getStoredProperties(long mask);
	// record properties found by a traversal. only the bits in known are meaningful
	protected abstract void updateProperties(long props, long known);

	public int getNumStatesIfKnown() {
		return UNKNOWN_STATE_COUNT;
	}

	public int getNumArcs(int s) {
		return getArcs(s).size();
	}

	public int getNumInputEpsilons(int s) {
		int n = 0;
		for (Arc a : getArcs(s))
			if (a.getILabel() == Arc.EPSILON)
				n++;
		return n;
	}

	public int getNumOutputEpsilons(int s) {
		int n = 0;
		for (Arc a : getArcs(s))
			if (a.getOLabel() == Arc.EPSILON)
				n++;
		return n;
	}

	/**
	 * Property bits in mask. Stored bits are authoritative; if test is true and
	 * some bit in mask is not known yet, the whole automaton is scanned once and
	 * the result is stored.
	 */
	public long getProperties(long mask, boolean test) {
		// whether a bit is known depends on its partner, so look at all of them
		long props = getStoredProperties(Properties.FST_PROPERTIES);
		if (test) {
			long known = Properties.knownProperties(props);
			if ((mask & known) != mask) {
				boolean debug = false;
				if (debug) Debug.debug(debug, "Computing properties of "+getType()+" fst for mask "+Long.toHexString(mask));
				long computed = PropertyComputer.compute(this);
				updateProperties(computed, Properties.TRINARY_PROPERTIES);
				props = getStoredProperties(Properties.FST_PROPERTIES);
			}
		}
		return props & mask;
	}

	// convenience for checking the sticky error bit
	public boolean hasError() {
		return getProperties(Properties.ERROR, false) != 0;
	}

	// number of states, visiting all of them if they aren't known
	public static int countStates(Fst fst) {
		int n = fst.getNumStatesIfKnown();
		if (n != UNKNOWN_STATE_COUNT)
			return n;
		n = 0;
		StateIterator it = fst.getStates();
		while (it.hasNext()) {
			it.next();
			n++;
		}
		return n;
	}

	public static int countStates(List<? extends Fst> fsts) {
		int n = 0;
		for (Fst f : fsts)
			n += countStates(f);
		return n;
	}

	public static long countArcs(Fst fst) {
		long n = 0;
		StateIterator it = fst.getStates();
		while (it.hasNext())
			n += fst.getNumArcs(it.next());
		return n;
	}
}

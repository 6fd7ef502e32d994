package edu.isi.wfst;

import gnu.trove.TIntObjectHashMap;

import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Shared machinery for lazy automata. A subclass says how to find the start
 * state, a final weight and the arcs of a state; this class asks at most once
 * per state and remembers the answers. Everything public is synchronized, so
 * handles that share one cache can't corrupt it.
 */
public abstract class CacheImpl {

	private TIntObjectHashMap states;
	private int start;
	private boolean hasStart;
	// one more than the highest state id seen
	private int nknown;
	private long properties;
	private String type;
	private Semiring semiring;
	private SymbolTable isyms;
	private SymbolTable osyms;

	protected CacheImpl(String t, Semiring s) {
		states = new TIntObjectHashMap();
		start = Fst.NO_STATE;
		hasStart = false;
		nknown = 0;
		properties = 0;
		type = t;
		semiring = s;
		isyms = osyms = null;
	}

	protected abstract int computeStart();
	protected abstract double computeFinal(int s);
	// push every arc of s with pushArc
	protected abstract void expand(int s);

	private CacheState getState(int s) {
		if (s < 0)
			throw new IllegalArgumentException("Bad state id "+s);
		CacheState cs = (CacheState)states.get(s);
		if (cs == null) {
			cs = new CacheState();
			states.put(s, cs);
		}
		return cs;
	}

	private void noteState(int s) {
		if (s >= nknown)
			nknown = s+1;
	}

	public synchronized int getStart() {
		if (!hasStart) {
			start = computeStart();
			hasStart = true;
			if (start != Fst.NO_STATE)
				noteState(start);
		}
		return start;
	}

	public synchronized double getFinal(int s) {
		CacheState cs = getState(s);
		if (!cs.hasFinal) {
			cs.fin = computeFinal(s);
			cs.hasFinal = true;
		}
		return cs.fin;
	}

	private CacheState expanded(int s) {
		CacheState cs = getState(s);
		if (!cs.hasArcs) {
			expand(s);
			cs.hasArcs = true;
		}
		return cs;
	}

	public synchronized List<Arc> getArcs(int s) {
		return Collections.unmodifiableList(expanded(s).arcs);
	}
	public synchronized int getNumArcs(int s) {
		return expanded(s).arcs.size();
	}
	public synchronized int getNumInputEpsilons(int s) {
		return expanded(s).niepsilons;
	}
	public synchronized int getNumOutputEpsilons(int s) {
		return expanded(s).noepsilons;
	}

	// for use inside expand()
	protected void pushArc(int s, Arc a) {
		getState(s).pushArc(a);
		noteState(a.getNextState());
	}

	public synchronized boolean hasStart() {
		return hasStart;
	}
	public synchronized boolean hasFinal(int s) {
		CacheState cs = (CacheState)states.get(s);
		return cs != null && cs.hasFinal;
	}
	public synchronized boolean hasArcs(int s) {
		CacheState cs = (CacheState)states.get(s);
		return cs != null && cs.hasArcs;
	}
	public synchronized int getNumKnownStates() {
		return nknown;
	}
	// how many states have something cached
	public synchronized int getNumCachedStates() {
		return states.size();
	}

	public synchronized long getProperties(long mask) {
		return properties & mask;
	}
	// ERROR is never cleared
	public synchronized void setProperties(long props, long mask) {
		long err = properties & Properties.ERROR;
		properties = (properties & ~mask) | (props & mask) | err;
	}
	public void setProperties(long props) {
		setProperties(props, Properties.FST_PROPERTIES);
	}
	// bits learned from a scan; only fills in what isn't known
	public synchronized void updateProperties(long props, long known) {
		long newbits = known & ~Properties.knownProperties(properties);
		properties |= (props & newbits) | (props & Properties.ERROR);
	}
	protected void setError(String msg) {
		Debug.debug(true, type+" fst: "+msg);
		setProperties(Properties.ERROR, Properties.ERROR);
	}

	public String getType() { return type; }
	public Semiring getSemiring() { return semiring; }
	public synchronized SymbolTable getInputSymbols() { return isyms; }
	public synchronized SymbolTable getOutputSymbols() { return osyms; }
	protected synchronized void setInputSymbols(SymbolTable t) { isyms = t; }
	protected synchronized void setOutputSymbols(SymbolTable t) { osyms = t; }

	/**
	 * States in the order they're found: the start state, then everything
	 * reachable, expanding states as it goes. Every id below the highest one
	 * seen is returned.
	 */
	public StateIterator discoveryIterator() {
		return new DiscoveryIterator();
	}

	private class DiscoveryIterator implements StateIterator {
		private int s = 0;
		// next state to expand
		private int u = 0;
		private boolean started = false;

		public boolean hasNext() {
			if (!started) {
				getStart();
				started = true;
			}
			while (s >= getNumKnownStates() && u < getNumKnownStates()) {
				getNumArcs(u);
				u++;
			}
			return s < getNumKnownStates();
		}

		public int next() {
			if (!hasNext())
				throw new NoSuchElementException("No more states after "+s);
			return s++;
		}
	}
}

package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Array-backed mutable automaton. Handles made with copy(false) share their
 * storage until one of them changes something; that handle then gets its own
 * copy of the storage first.
 * <p>
 * Handles are counted when made and never uncounted, since nothing tells us
 * when one is dropped. So after a lazy wrapper has been built over a
 * VectorFst, the next change to it copies the storage once, even if the
 * wrapper is long gone. Build the wrapper after the edits where that copy
 * matters.
 */
public class VectorFst extends MutableFst {

	// one state: final weight, arcs, and epsilon counts kept up to date on change
	private static class VectorState {
		double fin;
		ArrayList<Arc> arcs;
		int niepsilons;
		int noepsilons;
		VectorState(double f) {
			fin = f;
			arcs = new ArrayList<Arc>();
			niepsilons = noepsilons = 0;
		}
		VectorState(VectorState o) {
			fin = o.fin;
			arcs = new ArrayList<Arc>(o.arcs);
			niepsilons = o.niepsilons;
			noepsilons = o.noepsilons;
		}
		void count(Arc a, int delta) {
			if (a.getILabel() == Arc.EPSILON)
				niepsilons += delta;
			if (a.getOLabel() == Arc.EPSILON)
				noepsilons += delta;
		}
	}

	// the storage. refs counts the handles made on it, dropped ones included
	private static class Impl {
		ArrayList<VectorState> states;
		int start;
		long props;
		Semiring semiring;
		SymbolTable isyms;
		SymbolTable osyms;
		int refs;
		Impl(Semiring s) {
			states = new ArrayList<VectorState>();
			start = NO_STATE;
			props = Properties.NULL_PROPERTIES | Properties.STATIC_PROPERTIES;
			semiring = s;
			isyms = osyms = null;
			refs = 1;
		}
		Impl(Impl o) {
			states = new ArrayList<VectorState>(o.states.size());
			for (VectorState vs : o.states)
				states.add(new VectorState(vs));
			start = o.start;
			props = o.props;
			semiring = o.semiring;
			isyms = o.isyms == null ? null : new SymbolTable(o.isyms);
			osyms = o.osyms == null ? null : new SymbolTable(o.osyms);
			refs = 1;
		}
	}

	private Impl impl;

	public VectorFst(Semiring s) {
		impl = new Impl(s);
	}

	// shallow handle on the same storage
	private VectorFst(VectorFst o) {
		impl = o.impl;
		impl.refs++;
	}

	// materialize any automaton (see assign)
	public VectorFst(Fst fst) {
		this(fst.getSemiring());
		assign(fst);
	}

	// break sharing before a change
	private void mutateCheck() {
		if (impl.refs > 1) {
			impl.refs--;
			impl = new Impl(impl);
		}
	}

	private VectorState state(int s) {
		if (s < 0 || s >= impl.states.size())
			throw new IllegalArgumentException("State "+s+" out of range; fst has "+impl.states.size()+" states");
		return impl.states.get(s);
	}

	public int getStart() { return impl.start; }
	public double getFinal(int s) { return state(s).fin; }
	public List<Arc> getArcs(int s) { return Collections.unmodifiableList(state(s).arcs); }
	public int getNumArcs(int s) { return state(s).arcs.size(); }
	public int getNumInputEpsilons(int s) { return state(s).niepsilons; }
	public int getNumOutputEpsilons(int s) { return state(s).noepsilons; }
	public int getNumStates() { return impl.states.size(); }
	public Semiring getSemiring() { return impl.semiring; }
	public SymbolTable getInputSymbols() { return impl.isyms; }
	public SymbolTable getOutputSymbols() { return impl.osyms; }
	public String getType() { return "vector"; }

	// safe copies get their own storage right away
	public VectorFst copy(boolean safe) {
		if (safe) {
			VectorFst ret = new VectorFst(impl.semiring);
			ret.impl = new Impl(impl);
			return ret;
		}
		return new VectorFst(this);
	}

	protected long getStoredProperties(long mask) {
		return impl.props & mask;
	}
	// found by a scan, so they hold for every handle on the storage
	protected void updateProperties(long props, long known) {
		long stored = impl.props;
		long newbits = known & ~Properties.knownProperties(stored);
		impl.props = stored | (props & newbits) | (props & Properties.ERROR);
	}

	public void setProperties(long props, long mask) {
		mutateCheck();
		long err = impl.props & Properties.ERROR;
		impl.props = (impl.props & ~mask) | (props & mask) | err;
	}

	public int addState() {
		mutateCheck();
		impl.states.add(new VectorState(impl.semiring.ZERO()));
		impl.props = Properties.addStateProperties(impl.props);
		return impl.states.size()-1;
	}

	public void reserveStates(int n) {
		mutateCheck();
		impl.states.ensureCapacity(n);
	}

	public void reserveArcs(int s, int n) {
		mutateCheck();
		state(s).arcs.ensureCapacity(n);
	}

	public void setStart(int s) {
		if (s != NO_STATE)
			state(s);
		mutateCheck();
		impl.start = s;
		impl.props = Properties.setStartProperties(impl.props);
	}

	public void setFinal(int s, double w) {
		mutateCheck();
		VectorState vs = state(s);
		impl.props = Properties.setFinalProperties(impl.props, vs.fin, w, impl.semiring);
		vs.fin = w;
	}

	public void addArc(int s, Arc arc) {
		mutateCheck();
		VectorState vs = state(s);
		Arc prev = vs.arcs.isEmpty() ? null : vs.arcs.get(vs.arcs.size()-1);
		impl.props = Properties.addArcProperties(impl.props, s, arc, prev, impl.semiring);
		vs.arcs.add(arc);
		vs.count(arc, 1);
	}

	public void setArc(int s, int i, Arc arc) {
		mutateCheck();
		VectorState vs = state(s);
		if (i < 0 || i >= vs.arcs.size())
			throw new IllegalArgumentException("Arc "+i+" out of range at state "+s);
		vs.count(vs.arcs.get(i), -1);
		vs.arcs.set(i, arc);
		vs.count(arc, 1);
		impl.props &= Properties.SET_ARC_PROPERTIES;
	}

	public void deleteStates() {
		mutateCheck();
		impl.states.clear();
		impl.start = NO_STATE;
		impl.props = Properties.deleteAllStatesProperties(impl.props, Properties.STATIC_PROPERTIES);
	}

	public void deleteStates(int[] dstates) {
		mutateCheck();
		int n = impl.states.size();
		int[] newid = new int[n];
		for (int i = 0; i < dstates.length; i++) {
			state(dstates[i]);
			newid[dstates[i]] = NO_STATE;
		}
		ArrayList<VectorState> kept = new ArrayList<VectorState>(n);
		for (int s = 0; s < n; s++) {
			if (newid[s] == NO_STATE)
				continue;
			newid[s] = kept.size();
			kept.add(impl.states.get(s));
		}
		for (VectorState vs : kept) {
			ArrayList<Arc> arcs = new ArrayList<Arc>(vs.arcs.size());
			vs.niepsilons = vs.noepsilons = 0;
			for (Arc a : vs.arcs) {
				int t = newid[a.getNextState()];
				if (t == NO_STATE)
					continue;
				Arc na = a.withNextState(t);
				arcs.add(na);
				vs.count(na, 1);
			}
			vs.arcs = arcs;
		}
		impl.states = kept;
		if (impl.start != NO_STATE)
			impl.start = newid[impl.start];
		impl.props = Properties.deleteStatesProperties(impl.props);
	}

	public void deleteArcs(int s) {
		mutateCheck();
		VectorState vs = state(s);
		vs.arcs.clear();
		vs.niepsilons = vs.noepsilons = 0;
		impl.props = Properties.deleteArcsProperties(impl.props);
	}

	public void setInputSymbols(SymbolTable t) {
		mutateCheck();
		impl.isyms = t == null ? null : new SymbolTable(t);
	}

	public void setOutputSymbols(SymbolTable t) {
		mutateCheck();
		impl.osyms = t == null ? null : new SymbolTable(t);
	}

	// true if this handle is sharing storage with another
	boolean isShared() {
		return impl.refs > 1;
	}
}

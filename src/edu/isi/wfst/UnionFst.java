package edu.isi.wfst;

import gnu.trove.TIntArrayList;
import gnu.trove.TIntIntHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Lazy union. State 0 is a new start state with an epsilon arc to the start
 * state of each term; every other state is some (term, term state) pair,
 * numbered when it's first reached. Terms can be added with addUnion until
 * state 0 has been expanded.
 */
public class UnionFst extends Fst {

	static class Impl extends CacheImpl {
		private ArrayList<Fst> terms;
		// per term: term state -> our state
		private ArrayList<TIntIntHashMap> stateMaps;
		// our state -> (term, term state). entry 0 is the new start state
		private TIntArrayList stateTerm;
		private TIntArrayList termState;

		Impl(Fst fst1, Fst fst2) {
			super("union", fst1.getSemiring());
			terms = new ArrayList<Fst>();
			stateMaps = new ArrayList<TIntIntHashMap>();
			stateTerm = new TIntArrayList();
			termState = new TIntArrayList();
			stateTerm.add(-1);
			termState.add(NO_STATE);
			setInputSymbols(fst1.getInputSymbols());
			setOutputSymbols(fst1.getOutputSymbols());
			terms.add(fst1);
			stateMaps.add(new TIntIntHashMap());
			setProperties(fst1.getProperties(Properties.FST_PROPERTIES, false) & Properties.COPY_PROPERTIES);
			add(fst2);
		}

		// copy with the same terms (safe copies of them if asked) and an empty cache
		Impl(Impl o, boolean safe) {
			super(o.getType(), o.getSemiring());
			terms = new ArrayList<Fst>();
			stateMaps = new ArrayList<TIntIntHashMap>();
			stateTerm = new TIntArrayList();
			termState = new TIntArrayList();
			stateTerm.add(-1);
			termState.add(NO_STATE);
			setInputSymbols(o.getInputSymbols());
			setOutputSymbols(o.getOutputSymbols());
			synchronized (o) {
				for (Fst f : o.terms) {
					terms.add(safe ? f.copy(true) : f);
					stateMaps.add(new TIntIntHashMap());
				}
			}
			setProperties(o.getProperties(Properties.FST_PROPERTIES));
		}

		synchronized void add(Fst fst) {
			if (hasArcs(0)) {
				setError("Can't add a term to a union whose start state has been expanded");
				return;
			}
			if (!SymbolTable.compatSymbols(getInputSymbols(), fst.getInputSymbols()) ||
					!SymbolTable.compatSymbols(getOutputSymbols(), fst.getOutputSymbols())) {
				setError("Symbol tables of new term don't match");
				return;
			}
			if (!getSemiring().sameAs(fst.getSemiring())) {
				setError("Can't add "+fst.getSemiring().getName()+" term to "+getSemiring().getName()+" union");
				return;
			}
			terms.add(fst.copy(false));
			stateMaps.add(new TIntIntHashMap());
			long props = getProperties(Properties.FST_PROPERTIES);
			setProperties(Properties.unionProperties(props, fst.getProperties(Properties.FST_PROPERTIES, false), true));
			for (Fst f : terms) {
				if (f.getStart() != NO_STATE) {
					long eps = Properties.EPSILONS | Properties.I_EPSILONS | Properties.O_EPSILONS;
					setProperties(eps, eps);
					break;
				}
			}
		}

		synchronized int getNumTerms() {
			return terms.size();
		}

		// our id for state s of term t
		private int findState(int t, int s) {
			TIntIntHashMap m = stateMaps.get(t);
			if (m.containsKey(s))
				return m.get(s);
			int id = stateTerm.size();
			m.put(s, id);
			stateTerm.add(t);
			termState.add(s);
			return id;
		}

		protected int computeStart() {
			return 0;
		}

		protected double computeFinal(int s) {
			if (s == 0)
				return getSemiring().ZERO();
			return terms.get(stateTerm.get(s)).getFinal(termState.get(s));
		}

		protected void expand(int s) {
			if (s == 0) {
				for (int t = 0; t < terms.size(); t++) {
					int ts = terms.get(t).getStart();
					if (ts != NO_STATE)
						pushArc(0, new Arc(Arc.EPSILON, Arc.EPSILON, getSemiring().ONE(), findState(t, ts)));
				}
				return;
			}
			int t = stateTerm.get(s);
			for (Arc a : terms.get(t).getArcs(termState.get(s)))
				pushArc(s, a.withNextState(findState(t, a.getNextState())));
		}

		long refreshedProperties(long mask) {
			if ((mask & Properties.ERROR) != 0) {
				synchronized (this) {
					for (Fst f : terms)
						if (f.hasError())
							setProperties(Properties.ERROR, Properties.ERROR);
				}
			}
			return getProperties(mask);
		}
	}

	private Impl impl;

	public UnionFst(Fst fst1, Fst fst2) {
		impl = new Impl(fst1.copy(false), fst2);
	}

	private UnionFst(Impl i) {
		impl = i;
	}

	// add another term; too late once the start state has been expanded
	public void addUnion(Fst fst) {
		impl.add(fst);
	}

	public int getNumTerms() {
		return impl.getNumTerms();
	}

	public int getStart() { return impl.getStart(); }
	public double getFinal(int s) { return impl.getFinal(s); }
	public List<Arc> getArcs(int s) { return impl.getArcs(s); }
	public int getNumArcs(int s) { return impl.getNumArcs(s); }
	public int getNumInputEpsilons(int s) { return impl.getNumInputEpsilons(s); }
	public int getNumOutputEpsilons(int s) { return impl.getNumOutputEpsilons(s); }
	public StateIterator getStates() { return impl.discoveryIterator(); }
	public Semiring getSemiring() { return impl.getSemiring(); }
	public SymbolTable getInputSymbols() { return impl.getInputSymbols(); }
	public SymbolTable getOutputSymbols() { return impl.getOutputSymbols(); }
	public String getType() { return impl.getType(); }

	// a shared copy is another handle on this union, so terms added through either show up in both
	public UnionFst copy(boolean safe) {
		if (safe)
			return new UnionFst(new Impl(impl, true));
		return new UnionFst(impl);
	}

	protected long getStoredProperties(long mask) {
		return impl.refreshedProperties(mask);
	}
	protected void updateProperties(long props, long known) {
		impl.updateProperties(props, known);
	}
}

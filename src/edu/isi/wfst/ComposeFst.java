package edu.isi.wfst;

import gnu.trove.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Lazy composition: output labels of the first automaton are matched with
 * input labels of the second. States are (s1, s2, filter state) triples,
 * numbered in the order they're reached. Epsilon moves are governed by the
 * ComposeFilter chosen in the options.
 */
public class ComposeFst extends Fst {

	// a composed state
	static final class StateTuple {
		final int s1;
		final int s2;
		final int fs;
		StateTuple(int a, int b, int f) {
			s1 = a;
			s2 = b;
			fs = f;
		}
		public boolean equals(Object o) {
			if (!(o instanceof StateTuple))
				return false;
			StateTuple t = (StateTuple)o;
			return t.s1 == s1 && t.s2 == s2 && t.fs == fs;
		}
		public int hashCode() {
			return (s1*7853 + s2)*7867 + fs;
		}
		public String toString() {
			return "("+s1+", "+s2+", "+fs+")";
		}
	}

	static class Impl extends CacheImpl {
		private final Fst fst1;
		private final Fst fst2;
		private final FilterType filterType;
		private final ComposeFilter filter;
		private TObjectIntHashMap stateIds;
		private ArrayList<StateTuple> tuples;

		Impl(Fst f1, Fst f2, FilterType ft) {
			super("compose", f1.getSemiring());
			fst1 = f1;
			fst2 = f2;
			filterType = ft;
			filter = ComposeFilter.create(ft, fst1, fst2);
			stateIds = new TObjectIntHashMap();
			tuples = new ArrayList<StateTuple>();
			setInputSymbols(fst1.getInputSymbols());
			setOutputSymbols(fst2.getOutputSymbols());
			setProperties(Properties.composeProperties(fst1.getProperties(Properties.FST_PROPERTIES, false),
					fst2.getProperties(Properties.FST_PROPERTIES, false)));
			if (!fst1.getSemiring().sameAs(fst2.getSemiring()))
				setError("Can't compose "+fst1.getSemiring().getName()+" fst with "+
						fst2.getSemiring().getName()+" fst");
			if (!SymbolTable.compatSymbols(fst1.getOutputSymbols(), fst2.getInputSymbols()))
				setError("Output symbols of the first fst don't match input symbols of the second");
		}

		Fst getFst1() { return fst1; }
		Fst getFst2() { return fst2; }
		FilterType getFilterType() { return filterType; }

		private int findState(int s1, int s2, int fs) {
			StateTuple t = new StateTuple(s1, s2, fs);
			if (stateIds.containsKey(t))
				return stateIds.get(t);
			int id = tuples.size();
			stateIds.put(t, id);
			tuples.add(t);
			return id;
		}

		synchronized StateTuple getTuple(int s) {
			return tuples.get(s);
		}

		protected int computeStart() {
			int s1 = fst1.getStart();
			int s2 = fst2.getStart();
			if (s1 == NO_STATE || s2 == NO_STATE)
				return NO_STATE;
			return findState(s1, s2, filter.start());
		}

		protected double computeFinal(int s) {
			StateTuple t = tuples.get(s);
			Semiring semiring = getSemiring();
			double f1 = fst1.getFinal(t.s1);
			if (semiring.isZero(f1))
				return semiring.ZERO();
			double f2 = fst2.getFinal(t.s2);
			return semiring.times(f1, f2);
		}

		protected void expand(int s) {
			boolean debug = false;
			StateTuple t = tuples.get(s);
			Semiring semiring = getSemiring();
			filter.setState(t.s1, t.s2, t.fs);
			List<Arc> arcs2 = fst2.getArcs(t.s2);
			// the first automaton stays put while the second takes an epsilon
			Arc loop1 = new Arc(Arc.EPSILON, Arc.NO_LABEL, semiring.ONE(), t.s1);
			matchArc(s, loop1, arcs2, t.s2);
			for (Arc arc1 : fst1.getArcs(t.s1))
				matchArc(s, arc1, arcs2, t.s2);
			if (debug) Debug.debug(debug, "Expanded "+t+" into "+getNumArcs(s)+" arcs");
		}

		// pair arc1 with every arc of the second automaton (at s2) that its output matches
		private void matchArc(int s, Arc arc1, List<Arc> arcs2, int s2) {
			int label = arc1.getOLabel();
			if (label == Arc.EPSILON) {
				Arc loop2 = new Arc(Arc.NO_LABEL, Arc.EPSILON, getSemiring().ONE(), s2);
				addArc(s, arc1, loop2);
			}
			int match = label == Arc.NO_LABEL ? Arc.EPSILON : label;
			for (Arc arc2 : arcs2)
				if (arc2.getILabel() == match)
					addArc(s, arc1, arc2);
		}

		private void addArc(int s, Arc arc1, Arc arc2) {
			int fs = filter.filterArc(arc1, arc2);
			if (fs == ComposeFilter.BLOCKED)
				return;
			int next = findState(arc1.getNextState(), arc2.getNextState(), fs);
			int ilabel = arc1.getILabel();
			int olabel = arc2.getOLabel();
			pushArc(s, new Arc(ilabel, olabel, getSemiring().times(arc1.getWeight(), arc2.getWeight()), next));
		}

		long refreshedProperties(long mask) {
			if ((mask & Properties.ERROR) != 0 && (fst1.hasError() || fst2.hasError()))
				setProperties(Properties.ERROR, Properties.ERROR);
			return getProperties(mask);
		}
	}

	Impl impl;

	public ComposeFst(Fst fst1, Fst fst2) {
		this(fst1, fst2, new ComposeOptions());
	}

	public ComposeFst(Fst fst1, Fst fst2, ComposeOptions options) {
		impl = new Impl(fst1.copy(false), fst2.copy(false), options.getFilterType());
	}

	protected ComposeFst(Impl i) {
		impl = i;
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

	public ComposeFst copy(boolean safe) {
		return new ComposeFst(copyImpl(safe));
	}

	// fresh impl over safe copies of the operands, or this one
	protected Impl copyImpl(boolean safe) {
		if (!safe)
			return impl;
		Impl i = new Impl(impl.getFst1().copy(true), impl.getFst2().copy(true), impl.getFilterType());
		if (impl.getProperties(Properties.ERROR) != 0)
			i.setProperties(Properties.ERROR, Properties.ERROR);
		return i;
	}

	protected long getStoredProperties(long mask) {
		return impl.refreshedProperties(mask);
	}
	protected void updateProperties(long props, long known) {
		impl.updateProperties(props, known);
	}

	public FilterType getFilterType() {
		return impl.getFilterType();
	}

	// the (s1, s2, filter state) triple behind composed state s
	public String describeState(int s) {
		return impl.getTuple(s).toString();
	}

	// for subclasses that find a problem with the operands
	protected void setError(String msg) {
		impl.setError(msg);
	}
}

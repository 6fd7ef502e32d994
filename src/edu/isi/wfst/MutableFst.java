package edu.isi.wfst;

import java.util.List;

// an automaton that can be built and changed in place. Every change moves the
// stored properties along with the functions in Properties, so nothing is rescanned
public abstract class MutableFst extends ExpandedFst {

	// new state id; states are numbered 0..n-1 in the order they're added
	public abstract int addState();
	public abstract void setStart(int s);
	public abstract void setFinal(int s, double w);
	public abstract void addArc(int s, Arc arc);
	// replace the i-th arc leaving s
	public abstract void setArc(int s, int i, Arc arc);
	// remove everything
	public abstract void deleteStates();
	// remove the given states and any arcs into them; remaining states are renumbered
	// in order
	public abstract void deleteStates(int[] dstates);
	public abstract void deleteArcs(int s);
	// overwrite the bits in mask. ERROR can be set this way but never cleared
	public abstract void setProperties(long props, long mask);
	public abstract void setInputSymbols(SymbolTable t);
	public abstract void setOutputSymbols(SymbolTable t);

	// capacity hints
	public void reserveStates(int n) {}
	public void reserveArcs(int s, int n) {}

	public abstract MutableFst copy(boolean safe);

	// first state id of the block
	public int addStates(int n) {
		int first = getNumStates();
		reserveStates(first+n);
		for (int i = 0; i < n; i++)
			addState();
		return first;
	}

	/**
	 * Replace the contents with a copy of fst, expanding it if it's lazy. State
	 * ids are kept; ids a lazy automaton never produced become empty states.
	 */
	public void assign(Fst fst) {
		boolean debug = false;
		deleteStates();
		if (!getSemiring().sameAs(fst.getSemiring())) {
			setError("Can't copy "+fst.getSemiring().getName()+" fst into "+getSemiring().getName()+" fst");
			return;
		}
		StateIterator sit = fst.getStates();
		while (sit.hasNext()) {
			int s = sit.next();
			ensureState(s);
			setFinal(s, fst.getFinal(s));
			List<Arc> arcs = fst.getArcs(s);
			reserveArcs(s, arcs.size());
			for (Arc a : arcs) {
				ensureState(a.getNextState());
				addArc(s, a);
			}
		}
		int start = fst.getStart();
		if (start != NO_STATE) {
			ensureState(start);
			setStart(start);
		}
		setInputSymbols(fst.getInputSymbols());
		setOutputSymbols(fst.getOutputSymbols());
		setProperties(fst.getProperties(Properties.COPY_PROPERTIES, false), Properties.COPY_PROPERTIES);
		if (debug) Debug.debug(debug, "Copied "+fst.getType()+" fst with "+getNumStates()+" states");
	}

	private void ensureState(int s) {
		while (getNumStates() <= s)
			addState();
	}

	// mark the automaton as broken and say why
	public void setError(String msg) {
		Debug.debug(true, getType()+" fst: "+msg);
		setProperties(Properties.ERROR, Properties.ERROR);
	}
}

package edu.isi.wfst;

import java.util.NoSuchElementException;

// an automaton that knows how many states it has without looking at them
public abstract class ExpandedFst extends Fst {

	public abstract int getNumStates();

	public int getNumStatesIfKnown() {
		return getNumStates();
	}

	public abstract ExpandedFst copy(boolean safe);

	// states of an expanded automaton are exactly 0..n-1
	public StateIterator getStates() {
		return new RangeStateIterator(getNumStates());
	}

	static class RangeStateIterator implements StateIterator {
		private int s = 0;
		private final int n;
		RangeStateIterator(int num) { n = num; }
		public boolean hasNext() { return s < n; }
		public int next() {
			if (s >= n)
				throw new NoSuchElementException("No states left after "+n);
			return s++;
		}
	}
}

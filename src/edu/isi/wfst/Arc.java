package edu.isi.wfst;

// a weighted transition: input label, output label, weight, destination.
// immutable; mappers build new ones. weight means nothing without the semiring 
// of the automaton that holds the arc
public final class Arc {
	// the "no symbol" label
	public static final int EPSILON = 0;
	// not a label at all; used for implicit epsilon loops in composition
	public static final int NO_LABEL = -1;

	private final int ilabel;
	private final int olabel;
	private final double weight;
	private final int nextstate;

	public Arc(int il, int ol, double w, int next) {
		ilabel = il;
		olabel = ol;
		weight = w;
		nextstate = next;
	}

	// final weights get passed through mappers as this kind of arc
	public static Arc finalArc(double w) {
		return new Arc(EPSILON, EPSILON, w, Fst.NO_STATE);
	}

	public int getILabel() { return ilabel; }
	public int getOLabel() { return olabel; }
	public double getWeight() { return weight; }
	public int getNextState() { return nextstate; }

	public Arc withNextState(int next) {
		return new Arc(ilabel, olabel, weight, next);
	}
	public Arc withWeight(double w) {
		return new Arc(ilabel, olabel, w, nextstate);
	}
	public Arc withLabels(int il, int ol) {
		return new Arc(il, ol, weight, nextstate);
	}
	// both labels epsilon
	public boolean isEpsilon() {
		return ilabel == EPSILON && olabel == EPSILON;
	}

	public boolean equals(Object o) {
		if (!(o instanceof Arc))
			return false;
		Arc a = (Arc)o;
		return a.ilabel == ilabel && a.olabel == olabel && 
			a.nextstate == nextstate && Double.compare(a.weight, weight) == 0;
	}
	public int hashCode() {
		long w = Double.doubleToLongBits(weight);
		int h = ilabel;
		h = 31*h + olabel;
		h = 31*h + nextstate;
		h = 31*h + (int)(w ^ (w >>> 32));
		return h;
	}
	public String toString() {
		return ilabel+":"+olabel+"/"+weight+" -> "+nextstate;
	}
}

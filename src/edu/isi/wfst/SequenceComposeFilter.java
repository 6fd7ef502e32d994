package edu.isi.wfst;

// the first automaton's epsilons are taken before the second's. Filter state 1
// means the second automaton has moved alone, so the first can't any more
public class SequenceComposeFilter extends ComposeFilter {
	private int fs;
	private boolean alleps1;
	private boolean noeps1;

	public SequenceComposeFilter(Fst f1, Fst f2) {
		super(f1, f2);
	}

	public void setState(int s1, int s2, int f) {
		fs = f;
		int neps = fst1.getNumOutputEpsilons(s1);
		alleps1 = allEpsilons(fst1, s1, neps);
		noeps1 = neps == 0;
	}

	public int filterArc(Arc arc1, Arc arc2) {
		if (arc1.getOLabel() == Arc.NO_LABEL)
			return alleps1 ? BLOCKED : (noeps1 ? 0 : 1);
		if (arc2.getILabel() == Arc.NO_LABEL)
			return fs != 0 ? BLOCKED : 0;
		return arc1.getOLabel() == Arc.EPSILON ? BLOCKED : 0;
	}
}

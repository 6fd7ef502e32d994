package edu.isi.wfst;

// the mirror of SequenceComposeFilter: the second automaton's epsilons go first
public class AltSequenceComposeFilter extends ComposeFilter {
	private int fs;
	private boolean alleps2;
	private boolean noeps2;

	public AltSequenceComposeFilter(Fst f1, Fst f2) {
		super(f1, f2);
	}

	public void setState(int s1, int s2, int f) {
		fs = f;
		int neps = fst2.getNumInputEpsilons(s2);
		alleps2 = allEpsilons(fst2, s2, neps);
		noeps2 = neps == 0;
	}

	public int filterArc(Arc arc1, Arc arc2) {
		if (arc2.getILabel() == Arc.NO_LABEL)
			return alleps2 ? BLOCKED : (noeps2 ? 0 : 1);
		if (arc1.getOLabel() == Arc.NO_LABEL)
			return fs == 1 ? BLOCKED : 0;
		return arc1.getOLabel() == Arc.EPSILON ? BLOCKED : 0;
	}
}

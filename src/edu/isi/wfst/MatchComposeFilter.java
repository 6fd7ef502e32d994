package edu.isi.wfst;

/**
 * Prefers pairing epsilons on both sides over moving one side alone. Filter
 * state 0: free; 1: the first automaton has been moving alone; 2: the second
 * has.
 */
public class MatchComposeFilter extends ComposeFilter {
	private int fs;
	private boolean alleps1, alleps2;
	private boolean noeps1, noeps2;

	public MatchComposeFilter(Fst f1, Fst f2) {
		super(f1, f2);
	}

	public void setState(int s1, int s2, int f) {
		fs = f;
		int neps1 = fst1.getNumOutputEpsilons(s1);
		int neps2 = fst2.getNumInputEpsilons(s2);
		alleps1 = allEpsilons(fst1, s1, neps1);
		alleps2 = allEpsilons(fst2, s2, neps2);
		noeps1 = neps1 == 0;
		noeps2 = neps2 == 0;
	}

	public int filterArc(Arc arc1, Arc arc2) {
		// epsilon on the first automaton only
		if (arc2.getILabel() == Arc.NO_LABEL) {
			if (fs == 0)
				return noeps2 ? 0 : (alleps2 ? BLOCKED : 1);
			return fs == 1 ? 1 : BLOCKED;
		}
		// epsilon on the second only
		if (arc1.getOLabel() == Arc.NO_LABEL) {
			if (fs == 0)
				return noeps1 ? 0 : (alleps1 ? BLOCKED : 2);
			return fs == 2 ? 2 : BLOCKED;
		}
		if (arc1.getOLabel() == Arc.EPSILON)
			return fs == 0 ? 0 : BLOCKED;
		return 0;
	}
}

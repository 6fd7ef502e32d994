package edu.isi.wfst;

// never pairs two real epsilons; either side may move alone at any time
public class NoMatchComposeFilter extends ComposeFilter {
	public NoMatchComposeFilter(Fst f1, Fst f2) {
		super(f1, f2);
	}
	public int filterArc(Arc arc1, Arc arc2) {
		return (arc1.getOLabel() != Arc.EPSILON || arc2.getILabel() != Arc.EPSILON) ? 0 : BLOCKED;
	}
}

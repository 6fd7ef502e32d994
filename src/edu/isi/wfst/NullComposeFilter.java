package edu.isi.wfst;

// only real arcs on both sides; neither automaton moves alone
public class NullComposeFilter extends ComposeFilter {
	public NullComposeFilter(Fst f1, Fst f2) {
		super(f1, f2);
	}
	public int filterArc(Arc arc1, Arc arc2) {
		return (arc1.getOLabel() == Arc.NO_LABEL || arc2.getILabel() == Arc.NO_LABEL) ? BLOCKED : 0;
	}
}

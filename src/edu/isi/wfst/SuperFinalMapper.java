package edu.isi.wfst;

/**
 * Moves every final weight onto an arc into a single new final state. The
 * arcs carry finalLabel on both sides (epsilon by default). The result has
 * exactly one final state, with weight one.
 */
public class SuperFinalMapper extends ArcMapper {
	private final Semiring semiring;
	private final int finalLabel;

	public SuperFinalMapper(Semiring s) {
		this(s, Arc.EPSILON);
	}
	public SuperFinalMapper(Semiring s, int label) {
		semiring = s;
		finalLabel = label;
	}

	public Arc map(Arc arc) {
		if (arc.getNextState() == Fst.NO_STATE && !semiring.isZero(arc.getWeight()))
			return new Arc(finalLabel, finalLabel, arc.getWeight(), Fst.NO_STATE);
		return arc;
	}
	public FinalAction getFinalAction() {
		return FinalAction.REQUIRE_SUPERFINAL;
	}
	protected long mapProperties(long inprops) {
		if (finalLabel == Arc.EPSILON)
			return inprops & Properties.ADD_SUPER_FINAL_PROPERTIES;
		return inprops & Properties.ADD_SUPER_FINAL_PROPERTIES &
			Properties.I_LABEL_INVARIANT_PROPERTIES & Properties.O_LABEL_INVARIANT_PROPERTIES;
	}
	public SuperFinalMapper copy() {
		return new SuperFinalMapper(semiring, finalLabel);
	}
}

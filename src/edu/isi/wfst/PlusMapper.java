package edu.isi.wfst;

// adds (semiring plus) a constant to every non-zero weight
public class PlusMapper extends ArcMapper {
	private final Semiring semiring;
	private final double weight;

	public PlusMapper(Semiring s, double w) {
		semiring = s;
		weight = w;
	}
	public Arc map(Arc arc) {
		if (semiring.isZero(arc.getWeight()))
			return arc;
		return arc.withWeight(semiring.plus(arc.getWeight(), weight));
	}
	protected long mapProperties(long inprops) {
		return inprops & Properties.WEIGHT_INVARIANT_PROPERTIES;
	}
	public PlusMapper copy() {
		return new PlusMapper(semiring, weight);
	}
}

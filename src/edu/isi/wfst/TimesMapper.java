package edu.isi.wfst;

// multiplies (semiring times) every non-zero weight by a constant on the right
public class TimesMapper extends ArcMapper {
	private final Semiring semiring;
	private final double weight;

	public TimesMapper(Semiring s, double w) {
		semiring = s;
		weight = w;
	}
	public Arc map(Arc arc) {
		if (semiring.isZero(arc.getWeight()))
			return arc;
		return arc.withWeight(semiring.times(arc.getWeight(), weight));
	}
	protected long mapProperties(long inprops) {
		return inprops & Properties.WEIGHT_INVARIANT_PROPERTIES;
	}
	public TimesMapper copy() {
		return new TimesMapper(semiring, weight);
	}
}

package edu.isi.wfst;

// every non-zero weight becomes one
public class RmWeightMapper extends ArcMapper {
	private final Semiring semiring;

	public RmWeightMapper(Semiring s) {
		semiring = s;
	}
	public Arc map(Arc arc) {
		return arc.withWeight(semiring.isZero(arc.getWeight()) ? semiring.ZERO() : semiring.ONE());
	}
	protected long mapProperties(long inprops) {
		return (inprops & Properties.WEIGHT_INVARIANT_PROPERTIES) | Properties.UNWEIGHTED;
	}
	public RmWeightMapper copy() {
		return new RmWeightMapper(semiring);
	}
}

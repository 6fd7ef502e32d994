package edu.isi.wfst;

// raises every weight to a fixed power
public class PowerMapper extends ArcMapper {
	private final Semiring semiring;
	private final double power;

	public PowerMapper(Semiring s, double p) {
		semiring = s;
		power = p;
	}
	public Arc map(Arc arc) {
		return arc.withWeight(semiring.power(arc.getWeight(), power));
	}
	protected long mapProperties(long inprops) {
		return inprops & Properties.WEIGHT_INVARIANT_PROPERTIES;
	}
	public PowerMapper copy() {
		return new PowerMapper(semiring, power);
	}
}

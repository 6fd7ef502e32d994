package edu.isi.wfst;

// rounds weights to multiples of delta
public class QuantizeMapper extends ArcMapper {
	public static final double DEFAULT_DELTA = 1.0F/1024.0F;

	private final Semiring semiring;
	private final double delta;

	public QuantizeMapper(Semiring s) {
		this(s, DEFAULT_DELTA);
	}
	public QuantizeMapper(Semiring s, double d) {
		semiring = s;
		delta = d;
	}
	public Arc map(Arc arc) {
		return arc.withWeight(semiring.quantize(arc.getWeight(), delta));
	}
	protected long mapProperties(long inprops) {
		return inprops & Properties.WEIGHT_INVARIANT_PROPERTIES;
	}
	public QuantizeMapper copy() {
		return new QuantizeMapper(semiring, delta);
	}
}

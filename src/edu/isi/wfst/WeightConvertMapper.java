package edu.isi.wfst;

/**
 * Moves weights from one semiring to another through their real values (see
 * Semiring.convert). A weight the target can't represent becomes the target's
 * zero and marks the mapper, and so the output, with ERROR.
 */
public class WeightConvertMapper extends ArcMapper {
	private final Semiring from;
	private final Semiring to;

	public WeightConvertMapper(Semiring f, Semiring t) {
		from = f;
		to = t;
	}

	public Arc map(Arc arc) {
		double w;
		try {
			w = to.convert(arc.getWeight(), from);
		}
		catch (UnusualConditionException e) {
			mapError("Couldn't convert "+from.getName()+" weight "+arc.getWeight()+" to "+to.getName()+": "+e.getMessage());
			w = to.ZERO();
		}
		return arc.withWeight(w);
	}
	public Semiring getSemiring(Semiring in) {
		return to;
	}
	protected long mapProperties(long inprops) {
		return inprops;
	}
	public WeightConvertMapper copy() {
		return new WeightConvertMapper(from, to);
	}
}

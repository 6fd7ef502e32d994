package edu.isi.wfst;

// replaces every non-zero weight w with one / w
public class InvertWeightMapper extends ArcMapper {
	private final Semiring semiring;

	public InvertWeightMapper(Semiring s) {
		semiring = s;
	}
	public Arc map(Arc arc) {
		if (semiring.isZero(arc.getWeight()))
			return arc;
		try {
			return arc.withWeight(semiring.divide(semiring.ONE(), arc.getWeight()));
		}
		catch (UnusualConditionException e) {
			mapError("Couldn't invert "+arc.getWeight()+": "+e.getMessage());
			return arc.withWeight(semiring.ZERO());
		}
	}
	protected long mapProperties(long inprops) {
		return inprops & Properties.WEIGHT_INVARIANT_PROPERTIES;
	}
	public InvertWeightMapper copy() {
		return new InvertWeightMapper(semiring);
	}
}

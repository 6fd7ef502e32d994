package edu.isi.wfst;

// weights into the reverse semiring
public class ReverseWeightMapper extends ArcMapper {
	private final Semiring semiring;

	public ReverseWeightMapper(Semiring s) {
		semiring = s;
	}
	public Arc map(Arc arc) {
		return arc.withWeight(semiring.reverse(arc.getWeight()));
	}
	protected long mapProperties(long inprops) {
		return inprops;
	}
	public ReverseWeightMapper copy() {
		return new ReverseWeightMapper(semiring);
	}
}

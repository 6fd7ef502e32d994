package edu.isi.wfst;

// changes nothing
public class IdentityArcMapper extends ArcMapper {
	public Arc map(Arc arc) {
		return arc;
	}
	protected long mapProperties(long inprops) {
		return inprops;
	}
	public IdentityArcMapper copy() {
		return new IdentityArcMapper();
	}
}

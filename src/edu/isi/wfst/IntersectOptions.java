package edu.isi.wfst;

// intersection is composition of acceptors, so it takes the same settings
public class IntersectOptions extends ComposeOptions {
	public IntersectOptions() {
		super();
	}
	public IntersectOptions(boolean c, FilterType f) {
		super(c, f);
	}
}

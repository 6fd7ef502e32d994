package edu.isi.wfst;

/**
 * Lazy intersection of two acceptors: paths whose label strings are accepted by
 * both, with weights multiplied. An operand that isn't an acceptor marks the
 * result with ERROR. For reasonable speed one of them should be sorted on input
 * labels; that isn't checked.
 */
public class IntersectFst extends ComposeFst {

	public IntersectFst(Fst fst1, Fst fst2) {
		this(fst1, fst2, new IntersectOptions());
	}

	public IntersectFst(Fst fst1, Fst fst2, ComposeOptions options) {
		super(fst1, fst2, options);
		boolean acceptors = fst1.getProperties(Properties.ACCEPTOR, true) != 0 &&
			fst2.getProperties(Properties.ACCEPTOR, true) != 0;
		if (!acceptors)
			setError("Input fsts are not acceptors");
	}

	private IntersectFst(Impl i) {
		super(i);
	}

	public IntersectFst copy(boolean safe) {
		return new IntersectFst(copyImpl(safe));
	}
}

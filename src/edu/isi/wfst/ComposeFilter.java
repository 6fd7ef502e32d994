package edu.isi.wfst;

/**
 * Decides which pairs of arcs composition may follow together, tracking what
 * it needs in a small integer filter state. Besides real arcs, each side has
 * an implicit epsilon self-loop that lets the other side move alone: on the
 * first automaton it's (0, NO_LABEL, ONE, s1), on the second (NO_LABEL, 0,
 * ONE, s2).
 */
public abstract class ComposeFilter {

	// "don't follow this pair"
	public static final int BLOCKED = -1;

	protected final Fst fst1;
	protected final Fst fst2;

	protected ComposeFilter(Fst f1, Fst f2) {
		fst1 = f1;
		fst2 = f2;
	}

	// filter state of the start state
	public int start() {
		return 0;
	}

	// called before the arcs of composed state (s1, s2, fs) are filtered
	public void setState(int s1, int s2, int fs) {}

	// the filter state after taking arc1 on the first automaton and arc2 on the
	// second, or BLOCKED
	public abstract int filterArc(Arc arc1, Arc arc2);

	// the filter for a given type. AUTO is the sequence filter
	public static ComposeFilter create(FilterType type, Fst f1, Fst f2) {
		switch (type) {
		case ALT_SEQUENCE:
			return new AltSequenceComposeFilter(f1, f2);
		case MATCH:
			return new MatchComposeFilter(f1, f2);
		case NO_MATCH:
			return new NoMatchComposeFilter(f1, f2);
		case NULL:
			return new NullComposeFilter(f1, f2);
		case TRIVIAL:
			return new TrivialComposeFilter(f1, f2);
		case AUTO:
		case SEQUENCE:
		default:
			return new SequenceComposeFilter(f1, f2);
		}
	}

	// state s of f has only epsilon arcs on the given side and isn't final
	protected static boolean allEpsilons(Fst f, int s, int neps) {
		return f.getNumArcs(s) == neps && f.getSemiring().isZero(f.getFinal(s));
	}
}

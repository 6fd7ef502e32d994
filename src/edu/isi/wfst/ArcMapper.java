package edu.isi.wfst;

/**
 * A rule for rewriting arcs, applied by ArcMap (eagerly) or ArcMapFst (lazily).
 * Final weights are mapped too: a final weight w reaches map() as the arc
 * (0, 0, w, NO_STATE), and getFinalAction() says what may come back.
 * <p>
 * A mapper that hits a weight it can't handle calls mapError; from then on
 * getProperties reports ERROR, and whatever automaton uses the mapper picks
 * that up.
 */
public abstract class ArcMapper {

	private boolean error = false;

	public abstract Arc map(Arc arc);

	// properties of the output given the input's
	protected abstract long mapProperties(long inprops);

	// a fresh mapper that does the same thing, for copies that mustn't share state
	public abstract ArcMapper copy();

	public FinalAction getFinalAction() {
		return FinalAction.NO_SUPERFINAL;
	}
	public SymbolsAction getInputSymbolsAction() {
		return SymbolsAction.COPY_SYMBOLS;
	}
	public SymbolsAction getOutputSymbolsAction() {
		return SymbolsAction.COPY_SYMBOLS;
	}

	// the weights of the output, given the input's
	public Semiring getSemiring(Semiring in) {
		return in;
	}

	public final long getProperties(long inprops) {
		long props = mapProperties(inprops);
		if (error)
			props |= Properties.ERROR;
		return props;
	}

	// one output state per input state and the count survives
	public boolean preservesStateCount() {
		return getFinalAction() == FinalAction.NO_SUPERFINAL &&
			(getProperties(Properties.EXPANDED) & Properties.EXPANDED) != 0;
	}

	protected void mapError(String msg) {
		Debug.debug(true, getClass().getSimpleName()+": "+msg);
		error = true;
	}
}

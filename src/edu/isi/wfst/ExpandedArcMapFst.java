package edu.isi.wfst;

import java.util.List;

/**
 * A lazily mapped automaton that knows how many states it has. Only possible
 * when the input knows its own count and the mapper never adds a superfinal
 * state, so output state s is input state s.
 */
public class ExpandedArcMapFst extends ExpandedFst {

	private final ArcMapFst fst;

	public ExpandedArcMapFst(ExpandedFst in, ArcMapper mapper) {
		this(in, MapperRef.owned(mapper));
	}

	public ExpandedArcMapFst(ExpandedFst in, MapperRef mapper) {
		if (!mapper.get().preservesStateCount())
			throw new IllegalArgumentException(mapper.get().getClass().getSimpleName()+
					" may change the number of states; can't build a counted map with it");
		fst = new ArcMapFst(in, mapper);
	}

	private ExpandedArcMapFst(ArcMapFst f) {
		fst = f;
	}

	public int getNumStates() {
		return ((ExpandedFst)fst.impl.getSource()).getNumStates();
	}

	public int getStart() { return fst.getStart(); }
	public double getFinal(int s) { return fst.getFinal(s); }
	public List<Arc> getArcs(int s) { return fst.getArcs(s); }
	public int getNumArcs(int s) { return fst.getNumArcs(s); }
	public int getNumInputEpsilons(int s) { return fst.getNumInputEpsilons(s); }
	public int getNumOutputEpsilons(int s) { return fst.getNumOutputEpsilons(s); }
	public Semiring getSemiring() { return fst.getSemiring(); }
	public SymbolTable getInputSymbols() { return fst.getInputSymbols(); }
	public SymbolTable getOutputSymbols() { return fst.getOutputSymbols(); }
	public String getType() { return fst.getType(); }

	public ExpandedArcMapFst copy(boolean safe) {
		return new ExpandedArcMapFst(fst.copy(safe));
	}

	protected long getStoredProperties(long mask) {
		return fst.getStoredProperties(mask);
	}
	protected void updateProperties(long props, long known) {
		fst.updateProperties(props, known);
	}

	public MapperRef getMapperRef() {
		return fst.getMapperRef();
	}
	public boolean hasArcs(int s) {
		return fst.hasArcs(s);
	}
}

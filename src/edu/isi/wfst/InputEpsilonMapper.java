package edu.isi.wfst;

// replaces every input label with epsilon
public class InputEpsilonMapper extends ArcMapper {
	public Arc map(Arc arc) {
		return arc.withLabels(Arc.EPSILON, arc.getOLabel());
	}
	public SymbolsAction getInputSymbolsAction() {
		return SymbolsAction.CLEAR_SYMBOLS;
	}
	protected long mapProperties(long inprops) {
		return (inprops & Properties.SET_ARC_PROPERTIES) | Properties.I_EPSILONS | Properties.I_LABEL_SORTED;
	}
	public InputEpsilonMapper copy() {
		return new InputEpsilonMapper();
	}
}

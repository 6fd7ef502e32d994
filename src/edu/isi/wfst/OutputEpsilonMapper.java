package edu.isi.wfst;

// replaces every output label with epsilon
public class OutputEpsilonMapper extends ArcMapper {
	public Arc map(Arc arc) {
		return arc.withLabels(arc.getILabel(), Arc.EPSILON);
	}
	public SymbolsAction getOutputSymbolsAction() {
		return SymbolsAction.CLEAR_SYMBOLS;
	}
	protected long mapProperties(long inprops) {
		return (inprops & Properties.SET_ARC_PROPERTIES) | Properties.O_EPSILONS | Properties.O_LABEL_SORTED;
	}
	public OutputEpsilonMapper copy() {
		return new OutputEpsilonMapper();
	}
}

package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

// small automata and ways of comparing them
class FstFixtures {

	static VectorFst fst(Semiring s, int nstates, int start) {
		VectorFst f = new VectorFst(s);
		f.addStates(nstates);
		if (start != Fst.NO_STATE)
			f.setStart(start);
		return f;
	}

	static void arc(MutableFst f, int s, int il, int ol, double w, int next) {
		f.addArc(s, new Arc(il, ol, w, next));
	}

	// acceptor for one string of labels, weight w on the first arc
	static VectorFst string(Semiring s, double w, int... labels) {
		VectorFst f = fst(s, labels.length+1, 0);
		for (int i = 0; i < labels.length; i++)
			arc(f, i, labels[i], labels[i], i == 0 ? w : s.ONE(), i+1);
		f.setFinal(labels.length, labels.length == 0 ? w : s.ONE());
		return f;
	}

	/**
	 * The part of f reachable from its start state, renumbered breadth-first
	 * in arc order, with each state's arcs sorted. Two automata with the same
	 * canonical form differ only in state numbering.
	 */
	static String canonical(Fst f) {
		int start = f.getStart();
		if (start == Fst.NO_STATE)
			return "empty";
		Map<Integer, Integer> ids = new HashMap<Integer, Integer>();
		List<Integer> order = new ArrayList<Integer>();
		ids.put(start, 0);
		order.add(start);
		for (int i = 0; i < order.size(); i++) {
			for (Arc a : f.getArcs(order.get(i))) {
				if (!ids.containsKey(a.getNextState())) {
					ids.put(a.getNextState(), order.size());
					order.add(a.getNextState());
				}
			}
		}
		StringBuffer sb = new StringBuffer();
		for (int i = 0; i < order.size(); i++) {
			int s = order.get(i);
			sb.append(i+" final "+f.getFinal(s)+":");
			List<String> arcs = new ArrayList<String>();
			for (Arc a : f.getArcs(s))
				arcs.add(" "+a.getILabel()+":"+a.getOLabel()+"/"+a.getWeight()+"->"+ids.get(a.getNextState()));
			Collections.sort(arcs);
			for (String a : arcs)
				sb.append(a);
			sb.append("\n");
		}
		return sb.toString();
	}

	// input strings (epsilons dropped) accepted by an acyclic f, with their summed weights
	static Map<String, Double> paths(Fst f) {
		Map<String, Double> ret = new TreeMap<String, Double>();
		if (f.getStart() == Fst.NO_STATE)
			return ret;
		Semiring sr = f.getSemiring();
		LinkedList<Object[]> agenda = new LinkedList<Object[]>();
		agenda.add(new Object[] { f.getStart(), "", sr.ONE() });
		while (!agenda.isEmpty()) {
			Object[] item = agenda.removeFirst();
			int s = (Integer)item[0];
			String str = (String)item[1];
			double w = (Double)item[2];
			double fin = f.getFinal(s);
			if (!sr.isZero(fin)) {
				double total = sr.times(w, fin);
				if (ret.containsKey(str))
					total = sr.plus(ret.get(str), total);
				ret.put(str, total);
			}
			for (Arc a : f.getArcs(s)) {
				String next = a.getILabel() == Arc.EPSILON ? str : (str.length() == 0 ? "" : str+" ")+a.getILabel();
				agenda.add(new Object[] { a.getNextState(), next, sr.times(w, a.getWeight()) });
			}
		}
		return ret;
	}

	// counts calls to map(); final action is up to the test
	static class CountingMapper extends ArcMapper {
		int calls = 0;
		private final FinalAction action;
		private final int finalLabel;
		CountingMapper() {
			this(FinalAction.NO_SUPERFINAL, Arc.EPSILON);
		}
		// final arcs with non-zero weight come back labelled finalLabel
		CountingMapper(FinalAction a, int label) {
			action = a;
			finalLabel = label;
		}
		public Arc map(Arc arc) {
			calls++;
			if (arc.getNextState() == Fst.NO_STATE && arc.getWeight() != Double.POSITIVE_INFINITY)
				return arc.withLabels(finalLabel, finalLabel);
			return arc;
		}
		public FinalAction getFinalAction() {
			return action;
		}
		protected long mapProperties(long inprops) {
			if (action == FinalAction.NO_SUPERFINAL)
				return inprops;
			return inprops & Properties.ADD_SUPER_FINAL_PROPERTIES;
		}
		public CountingMapper copy() {
			return new CountingMapper(action, finalLabel);
		}
	}
}

package edu.isi.wfst;

import java.util.ArrayList;

// what a lazy automaton has worked out so far about one of its states
class CacheState {
	double fin;
	boolean hasFinal;
	ArrayList<Arc> arcs;
	boolean hasArcs;
	int niepsilons;
	int noepsilons;

	CacheState() {
		hasFinal = false;
		arcs = new ArrayList<Arc>();
		hasArcs = false;
		niepsilons = noepsilons = 0;
	}

	void pushArc(Arc a) {
		arcs.add(a);
		if (a.getILabel() == Arc.EPSILON)
			niepsilons++;
		if (a.getOLabel() == Arc.EPSILON)
			noepsilons++;
	}
}

package edu.isi.wfst;

import gnu.trove.TIntArrayList;
import gnu.trove.TIntHashSet;
import gnu.trove.TIntStack;

import java.util.ArrayList;

// trims an automaton down to the states on some path from the start state to a
// final state
public class Connect {

	public static void connect(MutableFst fst) {
		boolean debug = false;
		int n = fst.getNumStates();
		int start = fst.getStart();
		if (start == Fst.NO_STATE) {
			fst.deleteStates();
			return;
		}
		Semiring semiring = fst.getSemiring();
		// reachable from the start
		TIntHashSet access = new TIntHashSet();
		TIntStack ready = new TIntStack();
		ready.push(start);
		access.add(start);
		// reverse arcs as we go
		ArrayList<TIntArrayList> incoming = new ArrayList<TIntArrayList>(n);
		for (int s = 0; s < n; s++)
			incoming.add(new TIntArrayList());
		for (int s = 0; s < n; s++)
			for (Arc a : fst.getArcs(s))
				incoming.get(a.getNextState()).add(s);
		while (ready.size() > 0) {
			int s = ready.pop();
			for (Arc a : fst.getArcs(s)) {
				if (access.add(a.getNextState()))
					ready.push(a.getNextState());
			}
		}
		// can reach a final state
		TIntHashSet coaccess = new TIntHashSet();
		for (int s = 0; s < n; s++) {
			if (!semiring.isZero(fst.getFinal(s))) {
				coaccess.add(s);
				ready.push(s);
			}
		}
		while (ready.size() > 0) {
			int s = ready.pop();
			TIntArrayList in = incoming.get(s);
			for (int i = 0; i < in.size(); i++) {
				if (coaccess.add(in.get(i)))
					ready.push(in.get(i));
			}
		}
		TIntArrayList dstates = new TIntArrayList();
		for (int s = 0; s < n; s++)
			if (!access.contains(s) || !coaccess.contains(s))
				dstates.add(s);
		if (debug) Debug.debug(debug, "Removing "+dstates.size()+" of "+n+" states");
		fst.deleteStates(dstates.toNativeArray());
		fst.setProperties(Properties.ACCESSIBLE | Properties.CO_ACCESSIBLE,
				Properties.ACCESSIBLE | Properties.NOT_ACCESSIBLE | Properties.CO_ACCESSIBLE | Properties.NOT_CO_ACCESSIBLE);
	}
}

package edu.isi.wfst;

import gnu.trove.TIntArrayList;
import gnu.trove.TIntHashSet;
import gnu.trove.TIntIntHashMap;
import gnu.trove.TIntStack;

import java.util.List;

// finds every trinary property of an automaton by looking at all of it. Cycles,
// reachability and coreachability come from one strongly-connected-component
// pass (Tarjan, with explicit stacks); the rest are local to each state.
public class PropertyComputer {

	private Fst fst;
	private Semiring semiring;
	private TIntIntHashMap dfnum;
	private TIntIntHashMap low;
	private TIntIntHashMap scc;
	private TIntHashSet onStack;
	private TIntStack tarjan;
	// per component
	private TIntArrayList sccCyclic;
	private TIntArrayList sccCoaccessible;
	private int counter;

	private PropertyComputer(Fst f) {
		fst = f;
		semiring = f.getSemiring();
		dfnum = new TIntIntHashMap();
		low = new TIntIntHashMap();
		scc = new TIntIntHashMap();
		onStack = new TIntHashSet();
		tarjan = new TIntStack();
		sccCyclic = new TIntArrayList();
		sccCoaccessible = new TIntArrayList();
		counter = 0;
	}

	// the trinary bits of fst; every one of them is known in the result
	public static long compute(Fst fst) {
		return new PropertyComputer(fst).run();
	}

	private long run() {
		boolean debug = false;
		long props = 0;
		TIntArrayList states = new TIntArrayList();
		StateIterator sit = fst.getStates();
		while (sit.hasNext())
			states.add(sit.next());

		int start = fst.getStart();
		if (start != Fst.NO_STATE)
			visit(start);
		boolean accessible = states.size() == dfnum.size();
		for (int i = 0; i < states.size(); i++) {
			if (!dfnum.containsKey(states.get(i)))
				visit(states.get(i));
		}

		boolean acceptor = true, ideterministic = true, odeterministic = true;
		boolean epsilons = false, iepsilons = false, oepsilons = false;
		boolean isorted = true, osorted = true, weighted = false;
		boolean cyclic = false, topsorted = true, coaccessible = true;
		boolean string = true, weightedCycles = false;
		int nfinal = 0;
		for (int c = 0; c < sccCyclic.size(); c++)
			if (sccCyclic.get(c) != 0)
				cyclic = true;
		for (int i = 0; i < states.size(); i++) {
			int s = states.get(i);
			List<Arc> arcs = fst.getArcs(s);
			TIntHashSet ilabels = new TIntHashSet();
			TIntHashSet olabels = new TIntHashSet();
			Arc prev = null;
			for (Arc a : arcs) {
				if (a.getILabel() != a.getOLabel())
					acceptor = false;
				if (a.getILabel() == Arc.EPSILON) {
					iepsilons = true;
					if (a.getOLabel() == Arc.EPSILON)
						epsilons = true;
				}
				if (a.getOLabel() == Arc.EPSILON)
					oepsilons = true;
				if (!ilabels.add(a.getILabel()))
					ideterministic = false;
				if (!olabels.add(a.getOLabel()))
					odeterministic = false;
				if (prev != null) {
					if (prev.getILabel() > a.getILabel())
						isorted = false;
					if (prev.getOLabel() > a.getOLabel())
						osorted = false;
				}
				if (!semiring.isZero(a.getWeight()) && !semiring.isOne(a.getWeight()))
					weighted = true;
				int t = a.getNextState();
				if (t <= s)
					topsorted = false;
				if (scc.get(s) == scc.get(t) && sccCyclic.get(scc.get(s)) != 0 &&
						!semiring.isOne(a.getWeight()))
					weightedCycles = true;
				prev = a;
			}
			double fin = fst.getFinal(s);
			if (!semiring.isZero(fin)) {
				nfinal++;
				if (!semiring.isOne(fin))
					weighted = true;
				if (arcs.size() > 0)
					string = false;
			}
			if (arcs.size() > 1)
				string = false;
			if (sccCoaccessible.get(scc.get(s)) == 0)
				coaccessible = false;
		}
		if (cyclic || nfinal > 1 || !accessible)
			string = false;
		if (cyclic)
			topsorted = false;
		boolean initialCyclic = start != Fst.NO_STATE && sccCyclic.get(scc.get(start)) != 0;

		props |= acceptor ? Properties.ACCEPTOR : Properties.NOT_ACCEPTOR;
		props |= ideterministic ? Properties.I_DETERMINISTIC : Properties.NON_I_DETERMINISTIC;
		props |= odeterministic ? Properties.O_DETERMINISTIC : Properties.NON_O_DETERMINISTIC;
		props |= epsilons ? Properties.EPSILONS : Properties.NO_EPSILONS;
		props |= iepsilons ? Properties.I_EPSILONS : Properties.NO_I_EPSILONS;
		props |= oepsilons ? Properties.O_EPSILONS : Properties.NO_O_EPSILONS;
		props |= isorted ? Properties.I_LABEL_SORTED : Properties.NOT_I_LABEL_SORTED;
		props |= osorted ? Properties.O_LABEL_SORTED : Properties.NOT_O_LABEL_SORTED;
		props |= weighted ? Properties.WEIGHTED : Properties.UNWEIGHTED;
		props |= cyclic ? Properties.CYCLIC : Properties.ACYCLIC;
		props |= initialCyclic ? Properties.INITIAL_CYCLIC : Properties.INITIAL_ACYCLIC;
		props |= topsorted ? Properties.TOP_SORTED : Properties.NOT_TOP_SORTED;
		props |= accessible ? Properties.ACCESSIBLE : Properties.NOT_ACCESSIBLE;
		props |= coaccessible ? Properties.CO_ACCESSIBLE : Properties.NOT_CO_ACCESSIBLE;
		props |= string ? Properties.STRING : Properties.NOT_STRING;
		props |= weightedCycles ? Properties.WEIGHTED_CYCLES : Properties.UNWEIGHTED_CYCLES;
		if (debug) Debug.debug(debug, states.size()+" states, "+sccCyclic.size()+" components: "+Properties.toString(props));
		return props;
	}

	// depth-first from root, closing off components as their roots finish
	private void visit(int root) {
		TIntStack dfsStates = new TIntStack();
		TIntStack dfsArcs = new TIntStack();
		discover(root, dfsStates, dfsArcs);
		while (dfsStates.size() > 0) {
			int s = dfsStates.peek();
			int i = dfsArcs.pop();
			List<Arc> arcs = fst.getArcs(s);
			if (i < arcs.size()) {
				dfsArcs.push(i+1);
				int t = arcs.get(i).getNextState();
				if (!dfnum.containsKey(t))
					discover(t, dfsStates, dfsArcs);
				else if (onStack.contains(t))
					low.put(s, Math.min(low.get(s), dfnum.get(t)));
				continue;
			}
			dfsStates.pop();
			if (low.get(s) == dfnum.get(s))
				closeComponent(s);
			if (dfsStates.size() > 0) {
				int parent = dfsStates.peek();
				low.put(parent, Math.min(low.get(parent), low.get(s)));
			}
		}
	}

	private void discover(int s, TIntStack dfsStates, TIntStack dfsArcs) {
		dfnum.put(s, counter);
		low.put(s, counter);
		counter++;
		tarjan.push(s);
		onStack.add(s);
		dfsStates.push(s);
		dfsArcs.push(0);
	}

	// everything on the tarjan stack down to root is one component. Any component
	// it leads to has already been closed, so coreachability is known for them
	private void closeComponent(int root) {
		int id = sccCyclic.size();
		TIntArrayList members = new TIntArrayList();
		int m;
		do {
			m = tarjan.pop();
			onStack.remove(m);
			scc.put(m, id);
			members.add(m);
		} while (m != root);
		boolean cyclic = members.size() > 1;
		boolean coacc = false;
		for (int i = 0; i < members.size(); i++) {
			int s = members.get(i);
			if (!semiring.isZero(fst.getFinal(s)))
				coacc = true;
			for (Arc a : fst.getArcs(s)) {
				int t = a.getNextState();
				if (t == s)
					cyclic = true;
				else if (scc.get(t) != id && sccCoaccessible.get(scc.get(t)) != 0)
					coacc = true;
			}
		}
		sccCyclic.add(cyclic ? 1 : 0);
		sccCoaccessible.add(coacc ? 1 : 0);
	}
}

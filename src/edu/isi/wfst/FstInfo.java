package edu.isi.wfst;

// summaries of automata, for checking what an operation built
public class FstInfo {

	// create a summary of an automaton and add it to a buffer. Lazy automata get
	// expanded in full
	public static void getFstCheck(StringBuffer buffer, String name, Fst fst) {
		Semiring semiring = fst.getSemiring();
		int nstates = 0;
		long narcs = 0;
		int nfinal = 0;
		long niepsilons = 0;
		long noepsilons = 0;
		StateIterator sit = fst.getStates();
		while (sit.hasNext()) {
			int s = sit.next();
			nstates++;
			narcs += fst.getNumArcs(s);
			niepsilons += fst.getNumInputEpsilons(s);
			noepsilons += fst.getNumOutputEpsilons(s);
			if (!semiring.isZero(fst.getFinal(s)))
				nfinal++;
		}
		buffer.append("Fst info for "+name+":\n");
		buffer.append("\ttype "+fst.getType()+", "+semiring.getName()+" weights\n");
		if (fst.getStart() == Fst.NO_STATE)
			buffer.append("\tno start state\n");
		else
			buffer.append("\tstart state "+fst.getStart()+"\n");
		buffer.append("\t"+nstates+" states\n");
		buffer.append("\t"+narcs+" arcs\n");
		buffer.append("\t"+nfinal+" final states\n");
		buffer.append("\t"+niepsilons+" input epsilons, "+noepsilons+" output epsilons\n");
		if (fst.getInputSymbols() != null)
			buffer.append("\tinput symbols "+fst.getInputSymbols()+"\n");
		if (fst.getOutputSymbols() != null)
			buffer.append("\toutput symbols "+fst.getOutputSymbols()+"\n");
		buffer.append("\tproperties: "+Properties.toString(fst.getProperties(Properties.FST_PROPERTIES, false))+"\n");
	}

	public static String getFstCheck(String name, Fst fst) {
		StringBuffer sb = new StringBuffer();
		getFstCheck(sb, name, fst);
		return sb.toString();
	}
}

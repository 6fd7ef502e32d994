package edu.isi.wfst;

// eager intersection of acceptors
public class Intersect {

	public static void intersect(Fst fst1, Fst fst2, MutableFst ofst) {
		intersect(fst1, fst2, ofst, new IntersectOptions());
	}

	/**
	 * Write the intersection of fst1 and fst2 into ofst, replacing what it held,
	 * then (if options say so) drop states that aren't on a successful path.
	 */
	public static void intersect(Fst fst1, Fst fst2, MutableFst ofst, ComposeOptions options) {
		boolean debug = false;
		long start = System.currentTimeMillis();
		IntersectFst ifst = new IntersectFst(fst1, fst2, options);
		ofst.assign(ifst);
		if (debug) Debug.debug(debug, "Intersected with "+options+" into "+ofst.getNumStates()+" states");
		if (options.isConnect())
			Connect.connect(ofst);
		Debug.dbtime(2, start, "Intersect");
	}
}

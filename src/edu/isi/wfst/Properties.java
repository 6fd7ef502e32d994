package edu.isi.wfst;

// property bits of an automaton and the functions that move them through
// operations. Binary properties are simply true or false. Trinary properties come
// in pairs (P, NOT_P): a set bit is known, both unset means unknown.
// Operations never rescan a graph to get their output properties; they use the
// functions in here on their inputs' bits.
public class Properties {

	// binary
	public static final long EXPANDED =           0x0000000000000001L;
	public static final long MUTABLE =            0x0000000000000002L;
	// a sticky flag: something went wrong building this automaton
	public static final long ERROR =              0x0000000000000004L;

	// trinary
	public static final long ACCEPTOR =           0x0000000000010000L;
	public static final long NOT_ACCEPTOR =       0x0000000000020000L;
	public static final long I_DETERMINISTIC =    0x0000000000040000L;
	public static final long NON_I_DETERMINISTIC =0x0000000000080000L;
	public static final long O_DETERMINISTIC =    0x0000000000100000L;
	public static final long NON_O_DETERMINISTIC =0x0000000000200000L;
	public static final long EPSILONS =           0x0000000000400000L;
	public static final long NO_EPSILONS =        0x0000000000800000L;
	public static final long I_EPSILONS =         0x0000000001000000L;
	public static final long NO_I_EPSILONS =      0x0000000002000000L;
	public static final long O_EPSILONS =         0x0000000004000000L;
	public static final long NO_O_EPSILONS =      0x0000000008000000L;
	public static final long I_LABEL_SORTED =     0x0000000010000000L;
	public static final long NOT_I_LABEL_SORTED = 0x0000000020000000L;
	public static final long O_LABEL_SORTED =     0x0000000040000000L;
	public static final long NOT_O_LABEL_SORTED = 0x0000000080000000L;
	public static final long WEIGHTED =           0x0000000100000000L;
	public static final long UNWEIGHTED =         0x0000000200000000L;
	public static final long CYCLIC =             0x0000000400000000L;
	public static final long ACYCLIC =            0x0000000800000000L;
	public static final long INITIAL_CYCLIC =     0x0000001000000000L;
	public static final long INITIAL_ACYCLIC =    0x0000002000000000L;
	public static final long TOP_SORTED =         0x0000004000000000L;
	public static final long NOT_TOP_SORTED =     0x0000008000000000L;
	public static final long ACCESSIBLE =         0x0000010000000000L;
	public static final long NOT_ACCESSIBLE =     0x0000020000000000L;
	public static final long CO_ACCESSIBLE =      0x0000040000000000L;
	public static final long NOT_CO_ACCESSIBLE =  0x0000080000000000L;
	public static final long STRING =             0x0000100000000000L;
	public static final long NOT_STRING =         0x0000200000000000L;
	public static final long WEIGHTED_CYCLES =    0x0000400000000000L;
	public static final long UNWEIGHTED_CYCLES =  0x0000800000000000L;

	public static final long BINARY_PROPERTIES = 0x0000000000000007L;
	public static final long TRINARY_PROPERTIES = 0x0000ffffffff0000L;
	public static final long POS_TRINARY_PROPERTIES = TRINARY_PROPERTIES & 0x5555555555555555L;
	public static final long NEG_TRINARY_PROPERTIES = TRINARY_PROPERTIES & 0xaaaaaaaaaaaaaaaaL;
	public static final long FST_PROPERTIES = BINARY_PROPERTIES | TRINARY_PROPERTIES;
	// what carries over when one automaton is copied into another
	public static final long COPY_PROPERTIES = ERROR | TRINARY_PROPERTIES;
	// properties that are a matter of the implementation, not the graph
	public static final long STATIC_PROPERTIES = EXPANDED | MUTABLE;

	// properties of the empty automaton
	public static final long NULL_PROPERTIES = ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC |
		NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED |
		UNWEIGHTED | ACYCLIC | INITIAL_ACYCLIC | TOP_SORTED | ACCESSIBLE | CO_ACCESSIBLE |
		STRING | UNWEIGHTED_CYCLES;

	// survive changing an arc in place
	public static final long SET_ARC_PROPERTIES = EXPANDED | MUTABLE | ERROR;

	// survive adding a super-final state with epsilon arcs
	public static final long ADD_SUPER_FINAL_PROPERTIES = EXPANDED | MUTABLE | ERROR |
		ACCEPTOR | NOT_ACCEPTOR | NON_I_DETERMINISTIC | NON_O_DETERMINISTIC |
		EPSILONS | I_EPSILONS | O_EPSILONS | NOT_I_LABEL_SORTED | NOT_O_LABEL_SORTED |
		WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC |
		NOT_TOP_SORTED | NOT_ACCESSIBLE | CO_ACCESSIBLE | NOT_CO_ACCESSIBLE |
		NOT_STRING | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

	// survive any change of weights that leaves zero weights alone
	public static final long WEIGHT_INVARIANT_PROPERTIES = EXPANDED | MUTABLE | ERROR |
		ACCEPTOR | NOT_ACCEPTOR | I_DETERMINISTIC | NON_I_DETERMINISTIC |
		O_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | NO_EPSILONS | I_EPSILONS |
		NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | NOT_I_LABEL_SORTED |
		O_LABEL_SORTED | NOT_O_LABEL_SORTED | CYCLIC | ACYCLIC | INITIAL_CYCLIC |
		INITIAL_ACYCLIC | TOP_SORTED | NOT_TOP_SORTED | ACCESSIBLE | NOT_ACCESSIBLE |
		CO_ACCESSIBLE | NOT_CO_ACCESSIBLE | STRING | NOT_STRING;

	// survive any change of input labels
	public static final long I_LABEL_INVARIANT_PROPERTIES = EXPANDED | MUTABLE | ERROR |
		O_DETERMINISTIC | NON_O_DETERMINISTIC | O_EPSILONS | NO_O_EPSILONS |
		O_LABEL_SORTED | NOT_O_LABEL_SORTED | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC |
		INITIAL_CYCLIC | INITIAL_ACYCLIC | TOP_SORTED | NOT_TOP_SORTED | ACCESSIBLE |
		NOT_ACCESSIBLE | CO_ACCESSIBLE | NOT_CO_ACCESSIBLE | STRING | NOT_STRING |
		WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

	// survive any change of output labels
	public static final long O_LABEL_INVARIANT_PROPERTIES = EXPANDED | MUTABLE | ERROR |
		I_DETERMINISTIC | NON_I_DETERMINISTIC | I_EPSILONS | NO_I_EPSILONS |
		I_LABEL_SORTED | NOT_I_LABEL_SORTED | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC |
		INITIAL_CYCLIC | INITIAL_ACYCLIC | TOP_SORTED | NOT_TOP_SORTED | ACCESSIBLE |
		NOT_ACCESSIBLE | CO_ACCESSIBLE | NOT_CO_ACCESSIBLE | STRING | NOT_STRING |
		WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

	// the positive properties that adding an arc can't create and the negative
	// ones it can
	private static final long ADD_ARC_PROPERTIES = EXPANDED | MUTABLE | ERROR |
		NOT_ACCEPTOR | NON_I_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS |
		I_EPSILONS | O_EPSILONS | NOT_I_LABEL_SORTED | NOT_O_LABEL_SORTED | WEIGHTED |
		CYCLIC | INITIAL_CYCLIC | NOT_TOP_SORTED | ACCESSIBLE | CO_ACCESSIBLE |
		WEIGHTED_CYCLES;

	private static final long DELETE_STATES_PROPERTIES = EXPANDED | MUTABLE | ERROR |
		ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC | NO_EPSILONS | NO_I_EPSILONS |
		NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED | UNWEIGHTED | ACYCLIC |
		INITIAL_ACYCLIC | TOP_SORTED | UNWEIGHTED_CYCLES;

	private static final long DELETE_ARCS_PROPERTIES = DELETE_STATES_PROPERTIES;

	// names for printing, pos/neg pairs in bit order
	private static final String[] NAMES = {
		"acceptor", "not acceptor", "input deterministic", "non input deterministic",
		"output deterministic", "non output deterministic", "input/output epsilons",
		"no input/output epsilons", "input epsilons", "no input epsilons",
		"output epsilons", "no output epsilons", "input label sorted",
		"not input label sorted", "output label sorted", "not output label sorted",
		"weighted", "unweighted", "cyclic", "acyclic", "cyclic at initial state",
		"acyclic at initial state", "top sorted", "not top sorted", "accessible",
		"not accessible", "coaccessible", "not coaccessible", "string", "not string",
		"weighted cycles", "unweighted cycles"
	};

	// all bits whose value is known
	public static long knownProperties(long props) {
		return BINARY_PROPERTIES | (props & TRINARY_PROPERTIES) |
			((props & POS_TRINARY_PROPERTIES) << 1) |
			((props & NEG_TRINARY_PROPERTIES) >>> 1);
	}

	// do two property sets agree on every bit known in both?
	public static boolean compatProperties(long props1, long props2) {
		long known = knownProperties(props1) & knownProperties(props2);
		long diff = known & (props1 ^ props2);
		return diff == 0;
	}

	// union of two automata (eager when delayed is false)
	public static long unionProperties(long props1, long props2, boolean delayed) {
		long outprops = (ACCEPTOR | UNWEIGHTED | UNWEIGHTED_CYCLES | ACYCLIC | ACCESSIBLE) &
			props1 & props2;
		outprops |= ERROR & (props1 | props2);
		outprops |= (NOT_ACCEPTOR | NON_I_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS |
				I_EPSILONS | O_EPSILONS | WEIGHTED | WEIGHTED_CYCLES | CYCLIC |
				NOT_ACCESSIBLE | NOT_CO_ACCESSIBLE) & (props1 | props2);
		// nothing ever leads back to the start
		outprops |= INITIAL_ACYCLIC;
		// the eager form always adds a connecting epsilon; a delayed one only has
		// them for terms with a start state, which the caller checks
		if (!delayed)
			outprops |= EPSILONS | I_EPSILONS | O_EPSILONS;
		outprops |= CO_ACCESSIBLE & props1 & props2;
		if (!delayed) {
			outprops |= (EXPANDED | MUTABLE) & props1;
			// the second automaton's states come after the first's
			outprops |= NOT_TOP_SORTED & (props1 | props2);
		}
		return outprops;
	}

	// composition of two automata
	public static long composeProperties(long props1, long props2) {
		long outprops = ERROR & (props1 | props2);
		if ((props1 & ACCEPTOR) != 0 && (props2 & ACCEPTOR) != 0) {
			outprops |= ACCEPTOR | ((NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS) &
					props1 & props2);
			if ((props1 & NO_I_EPSILONS) != 0 && (props2 & NO_I_EPSILONS) != 0)
				outprops |= I_DETERMINISTIC & props1 & props2;
		}
		else {
			// either side moving alone against the other's epsilon loop
			// yields epsilons on that side, so only input epsilons are ruled out
			outprops |= NO_I_EPSILONS & props1 & props2;
		}
		outprops |= (UNWEIGHTED | ACYCLIC) & props1 & props2;
		return outprops;
	}

	// fst properties after setting the start state
	public static long setStartProperties(long inprops) {
		long outprops = inprops & ~(INITIAL_CYCLIC | INITIAL_ACYCLIC | ACCESSIBLE |
				NOT_ACCESSIBLE | STRING | NOT_STRING | CO_ACCESSIBLE | NOT_CO_ACCESSIBLE);
		if ((inprops & ACYCLIC) != 0)
			outprops |= INITIAL_ACYCLIC;
		return outprops;
	}

	// fst properties after changing a final weight
	public static long setFinalProperties(long inprops, double oldWeight, double newWeight, Semiring semiring) {
		long outprops = inprops;
		if (!semiring.isZero(oldWeight) && !semiring.isOne(oldWeight))
			outprops &= ~WEIGHTED;
		if (!semiring.isZero(newWeight) && !semiring.isOne(newWeight)) {
			outprops |= WEIGHTED;
			outprops &= ~UNWEIGHTED;
		}
		outprops &= ~(CO_ACCESSIBLE | NOT_CO_ACCESSIBLE | STRING | NOT_STRING);
		return outprops;
	}

	// fst properties after adding a state
	public static long addStateProperties(long inprops) {
		return inprops & ~(ACCESSIBLE | NOT_ACCESSIBLE | CO_ACCESSIBLE | NOT_CO_ACCESSIBLE |
				STRING | NOT_STRING);
	}

	// fst properties after adding arc to state s. prev is the arc before it, or null
	public static long addArcProperties(long inprops, int s, Arc arc, Arc prev, Semiring semiring) {
		long outprops = inprops;
		if (arc.getILabel() != arc.getOLabel()) {
			outprops |= NOT_ACCEPTOR;
			outprops &= ~ACCEPTOR;
		}
		if (arc.getILabel() == Arc.EPSILON) {
			outprops |= I_EPSILONS;
			outprops &= ~NO_I_EPSILONS;
			if (arc.getOLabel() == Arc.EPSILON) {
				outprops |= EPSILONS;
				outprops &= ~NO_EPSILONS;
			}
		}
		if (arc.getOLabel() == Arc.EPSILON) {
			outprops |= O_EPSILONS;
			outprops &= ~NO_O_EPSILONS;
		}
		if (prev != null) {
			if (prev.getILabel() > arc.getILabel()) {
				outprops |= NOT_I_LABEL_SORTED;
				outprops &= ~I_LABEL_SORTED;
			}
			if (prev.getOLabel() > arc.getOLabel()) {
				outprops |= NOT_O_LABEL_SORTED;
				outprops &= ~O_LABEL_SORTED;
			}
		}
		if (!semiring.isZero(arc.getWeight()) && !semiring.isOne(arc.getWeight())) {
			outprops |= WEIGHTED;
			outprops &= ~UNWEIGHTED;
		}
		if (arc.getNextState() <= s) {
			outprops |= NOT_TOP_SORTED;
			outprops &= ~TOP_SORTED;
		}
		outprops &= ADD_ARC_PROPERTIES | ACCEPTOR | NO_EPSILONS | NO_I_EPSILONS |
			NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED | UNWEIGHTED | TOP_SORTED;
		if ((outprops & TOP_SORTED) != 0)
			outprops |= ACYCLIC | INITIAL_ACYCLIC;
		return outprops;
	}

	public static long deleteStatesProperties(long inprops) {
		return inprops & DELETE_STATES_PROPERTIES;
	}

	public static long deleteAllStatesProperties(long inprops, long staticProps) {
		return (inprops & ERROR) | NULL_PROPERTIES | staticProps;
	}

	public static long deleteArcsProperties(long inprops) {
		return inprops & DELETE_ARCS_PROPERTIES;
	}

	// readable list of the known trinary properties
	public static String toString(long props) {
		StringBuffer sb = new StringBuffer();
		if ((props & EXPANDED) != 0)
			sb.append("expanded ");
		if ((props & MUTABLE) != 0)
			sb.append("mutable ");
		if ((props & ERROR) != 0)
			sb.append("error ");
		for (int i = 0; i < NAMES.length; i++) {
			long bit = ACCEPTOR << i;
			if ((props & bit) != 0)
				sb.append("["+NAMES[i]+"] ");
		}
		return sb.toString().trim();
	}
}

package edu.isi.wfst;

// settings for building a lazily mapped automaton
public class ArcMapFstOptions {

	// whether ArcMapFst.create may hand back an automaton that knows its state count
	public enum PropagateExpanded { NO, IF_POSSIBLE ;
	private static final String list;
	public static final String getList() { return list;}
	static {
		StringBuffer sb = new StringBuffer();
		for (PropagateExpanded x: PropagateExpanded.values()) {
			sb.append(x.toString()+" ");
		}
		list = sb.toString();
	}
	public static PropagateExpanded get(String s) throws ConfigureException{
		for (PropagateExpanded x : PropagateExpanded.values()) {
			if (x.toString().equals(s))
				return x;
		}
		throw new ConfigureException("Invalid expansion setting ("+s+"); valid values are "+list);
	}
	}

	private PropagateExpanded propagateExpanded;

	public ArcMapFstOptions() {
		this(PropagateExpanded.NO);
	}
	public ArcMapFstOptions(PropagateExpanded p) {
		propagateExpanded = p;
	}

	public PropagateExpanded getPropagateExpanded() { return propagateExpanded; }
	public void setPropagateExpanded(PropagateExpanded p) { propagateExpanded = p; }
}

package edu.isi.wfst;

// which composition filter to use. The filter decides which epsilon moves of
// the two automata may be paired up, so that each path is built once
public enum FilterType { AUTO, SEQUENCE, ALT_SEQUENCE, MATCH, NO_MATCH, NULL, TRIVIAL ;
	private static final String list;
	public static final String getList() { return list;}
	static {
		StringBuffer sb = new StringBuffer();
		for (FilterType x: FilterType.values()) {
			sb.append(x.toString().toLowerCase()+" ");
		}
		list = sb.toString();
	}
	// case doesn't matter: "alt_sequence" and "ALT_SEQUENCE" are the same
	public static FilterType get(String s) throws ConfigureException{
		for (FilterType x : FilterType.values()) {
			if (x.toString().equalsIgnoreCase(s))
				return x;
		}
		throw new ConfigureException("Invalid filter type ("+s+"); valid values are "+list);
	}
}

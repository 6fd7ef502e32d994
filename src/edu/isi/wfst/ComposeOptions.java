package edu.isi.wfst;

// settings for composition: which filter, and whether the eager forms trim
// useless states afterwards
public class ComposeOptions {
	private FilterType filterType;
	private boolean connect;

	public ComposeOptions() {
		this(true, FilterType.AUTO);
	}
	public ComposeOptions(boolean c, FilterType f) {
		connect = c;
		filterType = f;
	}

	public FilterType getFilterType() { return filterType; }
	public void setFilterType(FilterType f) { filterType = f; }
	public boolean isConnect() { return connect; }
	public void setConnect(boolean c) { connect = c; }

	public String toString() {
		return "filter="+filterType.toString().toLowerCase()+" connect="+connect;
	}
}

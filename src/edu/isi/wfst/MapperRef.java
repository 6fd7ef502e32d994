package edu.isi.wfst;

// a mapper together with who is responsible for it. An owned mapper belongs to
// the automaton holding the reference; a borrowed one belongs to the caller and
// is only looked at
public abstract class MapperRef {

	protected final ArcMapper mapper;

	private MapperRef(ArcMapper m) {
		if (m == null)
			throw new IllegalArgumentException("Null mapper");
		mapper = m;
	}

	public ArcMapper get() {
		return mapper;
	}

	public abstract boolean isOwned();

	// reference for a copy of the holder: a safe copy gets a fresh mapper of its own,
	// any other copy keeps using this one
	public MapperRef forCopy(boolean safe) {
		if (safe)
			return new Owned(mapper.copy());
		return this;
	}

	public static MapperRef owned(ArcMapper m) {
		return new Owned(m);
	}

	public static MapperRef borrowed(ArcMapper m) {
		return new Borrowed(m);
	}

	public static final class Owned extends MapperRef {
		private Owned(ArcMapper m) { super(m); }
		public boolean isOwned() { return true; }
	}

	public static final class Borrowed extends MapperRef {
		private Borrowed(ArcMapper m) { super(m); }
		public boolean isOwned() { return false; }
	}
}

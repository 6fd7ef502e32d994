package edu.isi.wfst;

import gnu.trove.TIntObjectHashMap;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazily maps an automaton through an ArcMapper. Nothing is mapped until it's
 * asked for, and nothing is mapped twice: arcs are cached per state, and the
 * final weight of each input state goes through the mapper at most once no
 * matter whether it's reached by getFinal, by expanding the state, or by
 * iterating states.
 * <p>
 * If the mapper needs a superfinal state, output state ids are input state ids
 * with the superfinal state slotted in: at 0 for REQUIRE_SUPERFINAL, or at the
 * first unused id when it's first needed for ALLOW_SUPERFINAL. Ids at or above
 * it are shifted up by one.
 */
public class ArcMapFst extends Fst {

	static class Impl extends CacheImpl {
		private final Fst fst;
		private final MapperRef mapper;
		private final FinalAction finalAction;
		private int superfinal;
		// one more than the highest output id handed out
		private int nstates;
		// mapped final pseudo-arcs, by input state
		private TIntObjectHashMap finalArcs;

		Impl(Fst f, MapperRef m) {
			super("map", m.get().getSemiring(f.getSemiring()));
			fst = f;
			mapper = m;
			superfinal = NO_STATE;
			nstates = 0;
			finalArcs = new TIntObjectHashMap();
			ArcMapper am = mapper.get();
			if (am.getInputSymbolsAction() == SymbolsAction.COPY_SYMBOLS)
				setInputSymbols(fst.getInputSymbols());
			if (am.getOutputSymbolsAction() == SymbolsAction.COPY_SYMBOLS)
				setOutputSymbols(fst.getOutputSymbols());
			if (fst.getStart() == NO_STATE) {
				finalAction = FinalAction.NO_SUPERFINAL;
				setProperties(Properties.NULL_PROPERTIES);
			}
			else {
				finalAction = am.getFinalAction();
				setProperties(am.getProperties(fst.getProperties(Properties.COPY_PROPERTIES, false)));
				if (finalAction == FinalAction.REQUIRE_SUPERFINAL)
					superfinal = 0;
			}
			if (fst.hasError())
				setProperties(Properties.ERROR, Properties.ERROR);
		}

		Fst getSource() { return fst; }
		MapperRef getMapperRef() { return mapper; }
		FinalAction getFinalAction() { return finalAction; }
		synchronized int getSuperfinal() { return superfinal; }

		synchronized int findIState(int s) {
			if (superfinal == NO_STATE || s < superfinal)
				return s;
			return s-1;
		}

		synchronized int findOState(int is) {
			int os = is;
			if (!(superfinal == NO_STATE || is < superfinal))
				os++;
			if (os >= nstates)
				nstates = os+1;
			return os;
		}

		// the mapped final pseudo-arc of input state is
		synchronized Arc finalArc(int is) {
			Arc a = (Arc)finalArcs.get(is);
			if (a == null) {
				a = mapper.get().map(Arc.finalArc(fst.getFinal(is)));
				finalArcs.put(is, a);
			}
			return a;
		}
		synchronized int getNumMappedFinals() {
			return finalArcs.size();
		}

		private static boolean labeled(Arc a) {
			return a.getILabel() != Arc.EPSILON || a.getOLabel() != Arc.EPSILON;
		}

		protected int computeStart() {
			int s = fst.getStart();
			if (s == NO_STATE)
				return NO_STATE;
			return findOState(s);
		}

		protected double computeFinal(int s) {
			noteOState(s);
			Semiring semiring = getSemiring();
			switch (finalAction) {
			case ALLOW_SUPERFINAL:
				if (s == superfinal)
					return semiring.ONE();
				Arc a = finalArc(findIState(s));
				return labeled(a) ? semiring.ZERO() : a.getWeight();
			case REQUIRE_SUPERFINAL:
				return s == superfinal ? semiring.ONE() : semiring.ZERO();
			default:
				Arc fa = finalArc(findIState(s));
				if (labeled(fa))
					setError("Mapped final weight of state "+s+" has labels "+fa.getILabel()+":"+fa.getOLabel());
				return fa.getWeight();
			}
		}

		protected void expand(int s) {
			boolean debug = false;
			if (s == superfinal)
				return;
			noteOState(s);
			int is = findIState(s);
			ArcMapper am = mapper.get();
			for (Arc a : fst.getArcs(is))
				pushArc(s, am.map(a.withNextState(findOState(a.getNextState()))));
			switch (finalAction) {
			case ALLOW_SUPERFINAL: {
				Arc fa = finalArc(is);
				if (labeled(fa)) {
					synchronized (this) {
						if (superfinal == NO_STATE) {
							superfinal = nstates++;
							if (debug) Debug.debug(debug, "Superfinal state is "+superfinal);
						}
					}
					pushArc(s, fa.withNextState(superfinal));
				}
				break;
			}
			case REQUIRE_SUPERFINAL: {
				Arc fa = finalArc(is);
				if (labeled(fa) || !getSemiring().isZero(fa.getWeight()))
					pushArc(s, fa.withNextState(superfinal));
				break;
			}
			default:
				break;
			}
		}

		// the error bit may have turned up in the source or the mapper since construction
		long refreshedProperties(long mask) {
			if ((mask & Properties.ERROR) != 0 &&
					(fst.getProperties(Properties.ERROR, false) != 0 ||
					 (mapper.get().getProperties(0) & Properties.ERROR) != 0))
				setProperties(Properties.ERROR, Properties.ERROR);
			return getProperties(mask);
		}

		// an id that has been given out or asked about. ids in use before the
		// superfinal state exists must keep meaning the same input state
		synchronized void noteOState(int s) {
			if (s >= nstates)
				nstates = s+1;
		}

		synchronized int ensureSuperfinal() {
			if (superfinal == NO_STATE)
				superfinal = nstates++;
			return superfinal;
		}
	}

	// output states are the input states plus, if there is one, the superfinal state
	private static class MapStateIterator implements StateIterator {
		private final Impl impl;
		private final StateIterator siter;
		private int s;
		private boolean superfinal;

		MapStateIterator(Impl i) {
			impl = i;
			siter = impl.getSource().getStates();
			s = 0;
			superfinal = impl.getFinalAction() == FinalAction.REQUIRE_SUPERFINAL;
		}

		public boolean hasNext() {
			return siter.hasNext() || superfinal;
		}

		public int next() {
			if (siter.hasNext()) {
				int is = siter.next();
				if (impl.getFinalAction() == FinalAction.ALLOW_SUPERFINAL && !superfinal) {
					Arc fa = impl.finalArc(is);
					if (fa.getILabel() != Arc.EPSILON || fa.getOLabel() != Arc.EPSILON)
						superfinal = true;
				}
				impl.noteOState(s);
				return s++;
			}
			if (!superfinal)
				throw new NoSuchElementException("No more states after "+s);
			superfinal = false;
			if (impl.getFinalAction() == FinalAction.ALLOW_SUPERFINAL)
				impl.ensureSuperfinal();
			impl.noteOState(s);
			return s++;
		}
	}

	Impl impl;

	// the mapper becomes the automaton's own
	public ArcMapFst(Fst fst, ArcMapper mapper) {
		this(fst, MapperRef.owned(mapper));
	}

	public ArcMapFst(Fst fst, MapperRef mapper) {
		impl = new Impl(fst.copy(false), mapper);
	}

	private ArcMapFst(Impl i) {
		impl = i;
	}

	/**
	 * A lazily mapped automaton that knows its state count when options allow it
	 * and fst and mapper make it possible; an ordinary ArcMapFst otherwise.
	 */
	public static Fst create(Fst fst, ArcMapper mapper, ArcMapFstOptions options) {
		boolean debug = false;
		if (options.getPropagateExpanded() == ArcMapFstOptions.PropagateExpanded.IF_POSSIBLE &&
				fst instanceof ExpandedFst && mapper.preservesStateCount()) {
			if (debug) Debug.debug(debug, "Building counted map over "+fst.getType());
			return new ExpandedArcMapFst((ExpandedFst)fst, mapper);
		}
		return new ArcMapFst(fst, mapper);
	}

	public int getStart() { return impl.getStart(); }
	public double getFinal(int s) { return impl.getFinal(s); }
	public List<Arc> getArcs(int s) { return impl.getArcs(s); }

	public int getNumArcs(int s) {
		if (impl.getFinalAction() == FinalAction.NO_SUPERFINAL)
			return impl.getSource().getNumArcs(s);
		return impl.getNumArcs(s);
	}
	public int getNumInputEpsilons(int s) { return impl.getNumInputEpsilons(s); }
	public int getNumOutputEpsilons(int s) { return impl.getNumOutputEpsilons(s); }

	public StateIterator getStates() {
		return new MapStateIterator(impl);
	}

	public Semiring getSemiring() { return impl.getSemiring(); }
	public SymbolTable getInputSymbols() { return impl.getInputSymbols(); }
	public SymbolTable getOutputSymbols() { return impl.getOutputSymbols(); }
	public String getType() { return impl.getType(); }

	/**
	 * A shared copy uses the same cache, source and mapper. A safe copy gets a
	 * safe copy of the source, its own copy of the mapper and an empty cache.
	 */
	public ArcMapFst copy(boolean safe) {
		if (safe)
			return new ArcMapFst(new Impl(impl.getSource().copy(true), impl.getMapperRef().forCopy(true)));
		return new ArcMapFst(impl);
	}

	protected long getStoredProperties(long mask) {
		return impl.refreshedProperties(mask);
	}
	protected void updateProperties(long props, long known) {
		impl.updateProperties(props, known);
	}

	public MapperRef getMapperRef() {
		return impl.getMapperRef();
	}
	// the state that collects the final weights, or NO_STATE if there isn't one (yet)
	public int getSuperfinal() {
		return impl.getSuperfinal();
	}
	public boolean hasArcs(int s) {
		return impl.hasArcs(s);
	}
	public boolean hasFinal(int s) {
		return impl.hasFinal(s);
	}
	// how many input final weights have been through the mapper
	public int getNumMappedFinals() {
		return impl.getNumMappedFinals();
	}
	boolean sharesCacheWith(ArcMapFst other) {
		return impl == other.impl;
	}
}

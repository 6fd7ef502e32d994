package edu.isi.wfst;

import java.util.List;

/**
 * Eager arc mapping: every arc and final weight goes through the mapper once,
 * right now. See ArcMapFst for the lazy version.
 */
public class ArcMap {

	// map fst in place. A superfinal state, if any, goes after the existing states
	public static void map(MutableFst fst, ArcMapper mapper) {
		boolean debug = false;
		if (mapper.getInputSymbolsAction() == SymbolsAction.CLEAR_SYMBOLS)
			fst.setInputSymbols(null);
		if (mapper.getOutputSymbolsAction() == SymbolsAction.CLEAR_SYMBOLS)
			fst.setOutputSymbols(null);
		if (fst.getStart() == Fst.NO_STATE)
			return;
		Semiring semiring = fst.getSemiring();
		if (!semiring.sameAs(mapper.getSemiring(semiring))) {
			fst.setError("Can't map "+semiring.getName()+" weights to "+
					mapper.getSemiring(semiring).getName()+" in place");
			return;
		}
		long props = fst.getProperties(Properties.FST_PROPERTIES, false);
		FinalAction action = mapper.getFinalAction();
		int superfinal = Fst.NO_STATE;
		if (action == FinalAction.REQUIRE_SUPERFINAL) {
			superfinal = fst.addState();
			fst.setFinal(superfinal, semiring.ONE());
		}
		// the superfinal state may be added part way through
		for (int s = 0; s < fst.getNumStates(); s++) {
			if (s == superfinal)
				continue;
			int narcs = fst.getNumArcs(s);
			for (int i = 0; i < narcs; i++)
				fst.setArc(s, i, mapper.map(fst.getArcs(s).get(i)));
			Arc farc = mapper.map(Arc.finalArc(fst.getFinal(s)));
			switch (action) {
			case NO_SUPERFINAL:
				if (farc.getILabel() != Arc.EPSILON || farc.getOLabel() != Arc.EPSILON)
					fst.setError("Mapped final weight of state "+s+" has labels "+farc.getILabel()+":"+farc.getOLabel());
				fst.setFinal(s, farc.getWeight());
				break;
			case ALLOW_SUPERFINAL:
				if (farc.getILabel() != Arc.EPSILON || farc.getOLabel() != Arc.EPSILON) {
					if (superfinal == Fst.NO_STATE) {
						superfinal = fst.addState();
						fst.setFinal(superfinal, semiring.ONE());
						if (debug) Debug.debug(debug, "Added superfinal state "+superfinal);
					}
					fst.addArc(s, farc.withNextState(superfinal));
					fst.setFinal(s, semiring.ZERO());
				}
				else
					fst.setFinal(s, farc.getWeight());
				break;
			case REQUIRE_SUPERFINAL:
				if (farc.getILabel() != Arc.EPSILON || farc.getOLabel() != Arc.EPSILON ||
						!semiring.isZero(farc.getWeight()))
					fst.addArc(s, farc.withNextState(superfinal));
				fst.setFinal(s, semiring.ZERO());
				break;
			}
		}
		fst.setProperties(mapper.getProperties(props), Properties.FST_PROPERTIES);
	}

	/**
	 * Map ifst into ofst, which is cleared first. Input state s is output state
	 * s; a superfinal state is numbered after all of them (REQUIRE_SUPERFINAL) or
	 * when first needed (ALLOW_SUPERFINAL).
	 */
	public static void map(Fst ifst, MutableFst ofst, ArcMapper mapper) {
		boolean debug = false;
		ofst.deleteStates();
		if (mapper.getInputSymbolsAction() == SymbolsAction.COPY_SYMBOLS)
			ofst.setInputSymbols(ifst.getInputSymbols());
		else if (mapper.getInputSymbolsAction() == SymbolsAction.CLEAR_SYMBOLS)
			ofst.setInputSymbols(null);
		if (mapper.getOutputSymbolsAction() == SymbolsAction.COPY_SYMBOLS)
			ofst.setOutputSymbols(ifst.getOutputSymbols());
		else if (mapper.getOutputSymbolsAction() == SymbolsAction.CLEAR_SYMBOLS)
			ofst.setOutputSymbols(null);
		long iprops = ifst.getProperties(Properties.COPY_PROPERTIES, false);
		if (ifst.getStart() == Fst.NO_STATE) {
			if ((iprops & Properties.ERROR) != 0)
				ofst.setProperties(Properties.ERROR, Properties.ERROR);
			return;
		}
		Semiring semiring = ofst.getSemiring();
		if (!semiring.sameAs(mapper.getSemiring(ifst.getSemiring()))) {
			ofst.setError("Mapper produces "+mapper.getSemiring(ifst.getSemiring()).getName()+
					" weights but destination holds "+semiring.getName());
			return;
		}
		FinalAction action = mapper.getFinalAction();
		int known = ifst.getNumStatesIfKnown();
		if (known != Fst.UNKNOWN_STATE_COUNT)
			ofst.reserveStates(known + (action == FinalAction.NO_SUPERFINAL ? 0 : 1));
		StateIterator sit = ifst.getStates();
		while (sit.hasNext()) {
			sit.next();
			ofst.addState();
		}
		int superfinal = Fst.NO_STATE;
		if (action == FinalAction.REQUIRE_SUPERFINAL) {
			superfinal = ofst.addState();
			ofst.setFinal(superfinal, semiring.ONE());
		}
		sit = ifst.getStates();
		while (sit.hasNext()) {
			int s = sit.next();
			if (s == ifst.getStart())
				ofst.setStart(s);
			List<Arc> arcs = ifst.getArcs(s);
			ofst.reserveArcs(s, arcs.size() + (action == FinalAction.NO_SUPERFINAL ? 0 : 1));
			for (Arc a : arcs)
				ofst.addArc(s, mapper.map(a));
			Arc farc = mapper.map(Arc.finalArc(ifst.getFinal(s)));
			switch (action) {
			case NO_SUPERFINAL:
				if (farc.getILabel() != Arc.EPSILON || farc.getOLabel() != Arc.EPSILON)
					ofst.setError("Mapped final weight of state "+s+" has labels "+farc.getILabel()+":"+farc.getOLabel());
				ofst.setFinal(s, farc.getWeight());
				break;
			case ALLOW_SUPERFINAL:
				if (farc.getILabel() != Arc.EPSILON || farc.getOLabel() != Arc.EPSILON) {
					if (superfinal == Fst.NO_STATE) {
						superfinal = ofst.addState();
						ofst.setFinal(superfinal, semiring.ONE());
						if (debug) Debug.debug(debug, "Added superfinal state "+superfinal);
					}
					ofst.addArc(s, farc.withNextState(superfinal));
					ofst.setFinal(s, semiring.ZERO());
				}
				else
					ofst.setFinal(s, farc.getWeight());
				break;
			case REQUIRE_SUPERFINAL:
				if (farc.getILabel() != Arc.EPSILON || farc.getOLabel() != Arc.EPSILON ||
						!semiring.isZero(farc.getWeight()))
					ofst.addArc(s, farc.withNextState(superfinal));
				ofst.setFinal(s, semiring.ZERO());
				break;
			}
		}
		long oprops = ofst.getProperties(Properties.FST_PROPERTIES, false);
		ofst.setProperties(mapper.getProperties(iprops) | oprops, Properties.FST_PROPERTIES);
	}
}

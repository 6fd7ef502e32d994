package edu.isi.wfst;

import java.util.NoSuchElementException;

// iterates over the state ids of an automaton. Lazy automata may discover 
// (and so expand) states while this runs
public interface StateIterator {
	public boolean hasNext();
	public int next() throws NoSuchElementException;
}

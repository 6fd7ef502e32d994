package edu.isi.wfst;

// what happens to a symbol table when an automaton is mapped
public enum SymbolsAction {
	COPY_SYMBOLS,
	CLEAR_SYMBOLS,
	// leave whatever the destination already has
	NOOP_SYMBOLS
}

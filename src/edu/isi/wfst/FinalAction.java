package edu.isi.wfst;

// what a mapper may do with final weights once they've been through map()
public enum FinalAction {
	// a mapped final arc must come back with no labels; its weight is the new final weight
	NO_SUPERFINAL,
	// a mapped final arc with labels becomes an arc to a new superfinal state, made
	// the first time it's needed
	ALLOW_SUPERFINAL,
	// every non-zero mapped final arc goes to the superfinal state, which is made up front
	REQUIRE_SUPERFINAL
}

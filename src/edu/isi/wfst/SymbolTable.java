package edu.isi.wfst;

import gnu.trove.TIntObjectHashMap;
import gnu.trove.TObjectIntHashMap;

// two-way map between symbol strings and integer labels. Label 0 is 
// conventionally epsilon but nothing here enforces it
public class SymbolTable {
	private String name;
	private TObjectIntHashMap symToLabel;
	private TIntObjectHashMap labelToSym;
	private int availableKey;

	public SymbolTable(String n) {
		name = n;
		symToLabel = new TObjectIntHashMap();
		labelToSym = new TIntObjectHashMap();
		availableKey = 0;
	}

	// copy constructor
	public SymbolTable(SymbolTable t) {
		this(t.name);
		int[] keys = t.labelToSym.keys();
		for (int i = 0; i < keys.length; i++)
			addSymbol((String)t.labelToSym.get(keys[i]), keys[i]);
	}

	public String getName() { return name; }
	public int getNumSymbols() { return labelToSym.size(); }

	// add with next free label; returns the existing label if it's already there
	public int addSymbol(String sym) {
		if (symToLabel.containsKey(sym))
			return symToLabel.get(sym);
		return addSymbol(sym, availableKey);
	}

	public int addSymbol(String sym, int label) {
		if (symToLabel.containsKey(sym))
			return symToLabel.get(sym);
		symToLabel.put(sym, label);
		labelToSym.put(label, sym);
		if (label >= availableKey)
			availableKey = label+1;
		return label;
	}

	// label of sym, or Arc.NO_LABEL
	public int find(String sym) {
		if (!symToLabel.containsKey(sym))
			return Arc.NO_LABEL;
		return symToLabel.get(sym);
	}

	// symbol for label, or null
	public String find(int label) {
		return (String)labelToSym.get(label);
	}

	// same labels mean the same symbols, regardless of name
	public boolean sameContents(SymbolTable t) {
		if (t.getNumSymbols() != getNumSymbols())
			return false;
		int[] keys = labelToSym.keys();
		for (int i = 0; i < keys.length; i++) {
			if (!labelToSym.get(keys[i]).equals(t.labelToSym.get(keys[i])))
				return false;
		}
		return true;
	}

	// tables are compatible if either is missing or they have the same contents
	public static boolean compatSymbols(SymbolTable a, SymbolTable b) {
		if (a == null || b == null)
			return true;
		if (a == b)
			return true;
		boolean compat = a.sameContents(b);
		if (!compat) 
			Debug.debug(true, "Symbol tables "+a.getName()+" and "+b.getName()+" don't match");
		return compat;
	}

	public String toString() {
		return name+" ("+getNumSymbols()+" symbols)";
	}
}

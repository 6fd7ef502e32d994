package edu.isi.wfst;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class SymbolTableTest {

	private SymbolTable letters(String name) {
		SymbolTable t = new SymbolTable(name);
		t.addSymbol("<eps>");
		t.addSymbol("a");
		t.addSymbol("b");
		return t;
	}

	@Test
	public void labelsInOrder() {
		SymbolTable t = letters("x");
		assertEquals(0, t.find("<eps>"));
		assertEquals(2, t.find("b"));
		assertEquals("a", t.find(1));
		assertEquals(1, t.addSymbol("a"));
		assertEquals(3, t.getNumSymbols());
		assertEquals(Arc.NO_LABEL, t.find("c"));
		assertNull(t.find(7));
		assertEquals(10, t.addSymbol("z", 10));
		assertEquals(11, t.addSymbol("y"));
	}

	@Test
	public void compatibility() {
		SymbolTable a = letters("one");
		SymbolTable b = letters("two");
		assertTrue(a.sameContents(b));
		assertTrue(SymbolTable.compatSymbols(a, b));
		assertTrue(SymbolTable.compatSymbols(a, null));
		assertTrue(SymbolTable.compatSymbols(null, null));
		b.addSymbol("c");
		assertFalse(SymbolTable.compatSymbols(a, b));
		SymbolTable c = new SymbolTable(a);
		assertTrue(c.sameContents(a));
		c.addSymbol("d");
		assertEquals(3, a.getNumSymbols());
	}
}

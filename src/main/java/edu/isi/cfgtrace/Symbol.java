package edu.isi.cfgtrace;
// a grammar symbol: a variable, a terminal, or the epsilon marker.
// all access goes through SymbolFactory, which interns them, so == is safe
public abstract class Symbol {
    abstract public String toString();

    public boolean isVariable() { return false; }
    public boolean isTerminal() { return false; }
    public boolean isEpsilon() { return false; }

    public static Symbol getEpsilon() {
	return EpsilonSymbol.INSTANCE;
    }
}

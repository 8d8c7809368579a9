package edu.isi.cfgtrace;

// the empty-string marker. only legal as the sole symbol of a production body
final class EpsilonSymbol extends Symbol {
    static final EpsilonSymbol INSTANCE = new EpsilonSymbol();

    private EpsilonSymbol() {}

    public boolean isEpsilon() { return true; }

    public String toString() { return SymbolFactory.EPSILON_TOKEN; }

    public int hashCode() { return -1; }

    public boolean equals(Object o) {
	return o == this;
    }
}

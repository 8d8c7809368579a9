package edu.isi.cfgtrace;

// single character of the terminal alphabet
public final class TerminalSymbol extends Symbol {
    private final char value;

    TerminalSymbol(char value) {
	this.value = value;
    }

    public char getValue() { return value; }

    public boolean isTerminal() { return true; }

    public String toString() { return String.valueOf(value); }

    // offset keeps terminal and variable hashes apart
    public int hashCode() { return 0x10000 + value; }

    public boolean equals(Object o) {
	if (!(o instanceof TerminalSymbol))
	    return false;
	return value == ((TerminalSymbol)o).value;
    }
}

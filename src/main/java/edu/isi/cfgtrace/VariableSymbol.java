package edu.isi.cfgtrace;

// single uppercase letter naming a variable (nonterminal)
public final class VariableSymbol extends Symbol {
    private final char name;

    VariableSymbol(char name) {
	this.name = name;
    }

    public char getName() { return name; }

    public boolean isVariable() { return true; }

    public String toString() { return String.valueOf(name); }

    public int hashCode() { return name; }

    public boolean equals(Object o) {
	if (!(o instanceof VariableSymbol))
	    return false;
	return name == ((VariableSymbol)o).name;
    }
}

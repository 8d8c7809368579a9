package edu.isi.cfgtrace;

// one substitution on a search path: which rule, applied at which position of the form
public final class Expansion {
    private final int position;
    private final CFGRule rule;

    Expansion(int position, CFGRule rule) {
	this.position = position;
	this.rule = rule;
    }

    public int getPosition() { return position; }
    public CFGRule getRule() { return rule; }

    public String toString() { return rule+" @"+position; }
}

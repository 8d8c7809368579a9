package edu.isi.cfgtrace;

/**
 * Stateless answers to "what kind of symbol is this" relative to one grammar.
 * A symbol of the right shape that the grammar never declared is neither a
 * variable nor a terminal of that grammar.
 */
public final class SymbolClassifier {

    private SymbolClassifier() {}

    public static boolean isVariable(CFGRuleSet g, Symbol s) {
	return s != null && s.isVariable() && g.getVariables().contains(s);
    }

    public static boolean isTerminal(CFGRuleSet g, Symbol s) {
	return s != null && s.isTerminal() && g.getTerminals().contains(s);
    }

    public static boolean isEpsilon(Symbol s) {
	return s != null && s.isEpsilon();
    }

    public static boolean isTerminalChar(CFGRuleSet g, char c) {
	return g.getTerminal(c) != null;
    }

    /**
     * Index of the first character of <code>target</code> that is not a declared
     * terminal of <code>g</code>, or -1 if every character is.
     */
    public static int firstForeignChar(CFGRuleSet g, String target) {
	for (int i = 0; i < target.length(); i++) {
	    if (!isTerminalChar(g, target.charAt(i)))
		return i;
	}
	return -1;
    }

    /**
     * Turn one token of production text into the grammar's symbol for it.
     *
     * @param g the grammar the token must be declared in
     * @param token a single variable letter, terminal character, or "epsilon"
     * @return the interned symbol
     * @throws InvalidSymbolException if the token fits no character class
     * @throws UnknownBodySymbolException if the token is well-formed but undeclared
     */
    public static Symbol classify(CFGRuleSet g, String token) throws InvalidSymbolException, UnknownBodySymbolException {
	if (SymbolFactory.isEpsilonText(token))
	    return Symbol.getEpsilon();
	if (SymbolFactory.isVariableText(token)) {
	    VariableSymbol v = SymbolFactory.getVariable(token);
	    if (!g.getVariables().contains(v))
		throw new UnknownBodySymbolException("Variable "+token+" is not declared");
	    return v;
	}
	if (SymbolFactory.isTerminalText(token)) {
	    TerminalSymbol t = SymbolFactory.getTerminal(token);
	    if (!g.getTerminals().contains(t))
		throw new UnknownBodySymbolException("Terminal "+token+" is not declared");
	    return t;
	}
	throw new InvalidSymbolException("\""+token+"\" is neither a variable, a terminal, nor "+SymbolFactory.EPSILON_TOKEN);
    }
}

package edu.isi.cfgtrace;

// checks character-class rules and interns symbols
import java.util.HashMap;
import java.util.regex.Pattern;
public class SymbolFactory {
    /** how the epsilon marker is written in grammar text */
    public static final String EPSILON_TOKEN = "epsilon";

    // variables are single uppercase letters
    private static Pattern varPat = Pattern.compile("[A-Z]");
    // terminals are single lowercase letters, digits, or common grammar punctuation
    private static Pattern termPat = Pattern.compile("[a-z0-9+\\-*/(){}\\[\\]:;.,><=!]");

    static private HashMap<Character, VariableSymbol> char2Var;
    static private HashMap<Character, TerminalSymbol> char2Term;
    static {
	char2Var = new HashMap<Character, VariableSymbol>();
	char2Term = new HashMap<Character, TerminalSymbol>();
    }

    public static boolean isVariableText(String str) {
	return str != null && varPat.matcher(str).matches();
    }
    public static boolean isTerminalText(String str) {
	return str != null && termPat.matcher(str).matches();
    }
    public static boolean isTerminalChar(char c) {
	return termPat.matcher(String.valueOf(c)).matches();
    }
    public static boolean isEpsilonText(String str) {
	return EPSILON_TOKEN.equals(str);
    }

    static public synchronized VariableSymbol getVariable(String str) throws InvalidSymbolException {
	boolean debug = false;
	if (!isVariableText(str))
	    throw new InvalidSymbolException("Invalid variable \""+str+"\": expected a single uppercase letter");
	char c = str.charAt(0);
	if (!char2Var.containsKey(c)) {
	    if (debug) Debug.debug(debug, "creating new variable "+c);
	    char2Var.put(c, new VariableSymbol(c));
	}
	return char2Var.get(c);
    }

    static public synchronized TerminalSymbol getTerminal(String str) throws InvalidSymbolException {
	if (!isTerminalText(str))
	    throw new InvalidSymbolException("Invalid terminal \""+str+"\": expected a lowercase letter, digit, or one of +-*/(){}[]:;.,><=!");
	return getTerminal(str.charAt(0));
    }

    static public synchronized TerminalSymbol getTerminal(char c) throws InvalidSymbolException {
	boolean debug = false;
	if (!char2Term.containsKey(c)) {
	    if (!isTerminalChar(c))
		throw new InvalidSymbolException("Invalid terminal '"+c+"'");
	    if (debug) Debug.debug(debug, "creating new terminal "+c);
	    char2Term.put(c, new TerminalSymbol(c));
	}
	return char2Term.get(c);
    }
}

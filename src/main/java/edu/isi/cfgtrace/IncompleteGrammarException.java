package edu.isi.cfgtrace;
/** for grammars missing variables, terminals, productions, or a start symbol when sealed */
public class IncompleteGrammarException extends GrammarException {
    /**          Constructs a new exception with null as its detail message. */
    public IncompleteGrammarException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public IncompleteGrammarException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public IncompleteGrammarException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public IncompleteGrammarException(Throwable cause) { super(cause); }
}

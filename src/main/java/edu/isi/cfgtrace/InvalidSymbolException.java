package edu.isi.cfgtrace;
/** for variables or terminals that break the character-class rules, or bodies that mix epsilon with other symbols */
public class InvalidSymbolException extends GrammarException {
    /**          Constructs a new exception with null as its detail message. */
    public InvalidSymbolException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public InvalidSymbolException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public InvalidSymbolException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public InvalidSymbolException(Throwable cause) { super(cause); }
}

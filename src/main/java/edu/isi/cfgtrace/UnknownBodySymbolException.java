package edu.isi.cfgtrace;
/** for production bodies that reference an undeclared variable or terminal */
public class UnknownBodySymbolException extends GrammarException {
    /**          Constructs a new exception with null as its detail message. */
    public UnknownBodySymbolException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public UnknownBodySymbolException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public UnknownBodySymbolException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public UnknownBodySymbolException(Throwable cause) { super(cause); }
}

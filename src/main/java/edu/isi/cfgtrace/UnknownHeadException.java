package edu.isi.cfgtrace;
/** for productions whose head was never declared as a variable */
public class UnknownHeadException extends GrammarException {
    /**          Constructs a new exception with null as its detail message. */
    public UnknownHeadException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public UnknownHeadException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public UnknownHeadException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public UnknownHeadException(Throwable cause) { super(cause); }
}

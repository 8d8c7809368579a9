package edu.isi.cfgtrace;
/** for edge lists that cannot have come from a derivation trace, i.e. a bug in the tracer */
public class InconsistentEdgesException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public InconsistentEdgesException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public InconsistentEdgesException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public InconsistentEdgesException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public InconsistentEdgesException(Throwable cause) { super(cause); }
}

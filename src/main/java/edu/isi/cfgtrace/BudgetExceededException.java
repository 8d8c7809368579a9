package edu.isi.cfgtrace;
/** for searches cut off by the explored-state budget before reaching an answer */
public class BudgetExceededException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public BudgetExceededException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public BudgetExceededException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public BudgetExceededException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public BudgetExceededException(Throwable cause) { super(cause); }
}

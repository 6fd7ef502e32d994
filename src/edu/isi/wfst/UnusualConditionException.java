package edu.isi.wfst;
/** Thrown by a semiring operation that has no result in its algebra: a weight
    the target semiring can't represent, a division by zero, and so on. The
    automaton operations never let it escape; they catch it and set the
    error property instead. */

public class UnusualConditionException extends Exception {
    private static final long serialVersionUID = 1L;
    /** no detail message */
    public UnusualConditionException() { super(); }
    /** detail message describes the offending operation and operands */
    public UnusualConditionException(String message) { super(message); }
    public UnusualConditionException(String message, Throwable cause) { super(message, cause); }
    public UnusualConditionException(Throwable cause) { super(cause); } 
}

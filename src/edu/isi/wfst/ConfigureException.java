package edu.isi.wfst;
/** Thrown while building operation options from names, e.g. an unknown
    compose filter type. */
public class ConfigureException extends Exception {
    private static final long serialVersionUID = 1L;
    public ConfigureException() { super(); }
    /** detail message should list the legal values */
    public ConfigureException(String message) { super(message); }
    public ConfigureException(String message, Throwable cause) { super(message, cause); }
    public ConfigureException(Throwable cause) { super(cause); } 
}

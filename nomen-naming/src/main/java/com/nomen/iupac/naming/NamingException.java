package com.nomen.iupac.naming;

/**
 * Thrown inside the pipeline when a structure cannot be named at all, for
 * example a substituent fragment without any parent candidate.
 *
 * <p>Never escapes {@link IupacNameGenerator}: the facade turns it into a
 * fallback name and an error entry.
 */
public class NamingException extends RuntimeException {

    public NamingException(String message) {
        super(message);
    }

    public NamingException(String message, Throwable cause) {
        super(message, cause);
    }
}

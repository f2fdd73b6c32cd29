package io.replicapacker.allocation;

/**
 * Exception thrown when a packing instance cannot be solved as given.
 */
public class PackingException extends Exception {
    
    public PackingException(String message) {
        super(message);
    }
    
    public PackingException(String message, Throwable cause) {
        super(message, cause);
    }
}

package net.wizeops.tiercache.exceptions;

/**
 * Remote tier unreachable, authentication rejected or TLS negotiation failed.
 */
public class InfrastructureException extends CacheException {

    public InfrastructureException(String message) {
        super(message);
    }

    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}

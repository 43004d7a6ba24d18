package tsproxy.server.store;

public class CacheStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

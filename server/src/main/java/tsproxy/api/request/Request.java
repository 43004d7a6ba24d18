package tsproxy.api.request;

public interface Request {

    default void validate() {
    }

}

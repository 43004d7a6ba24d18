package tsproxy.api.response;

import java.util.HashMap;
import java.util.Map;

public class TsProxyException extends Exception {

    private static final long serialVersionUID = 1L;
    private int code = 500;
    private String details = null;
    private Map<String, String> responseHeaders = new HashMap<>();

    public TsProxyException(int code, String message, String details) {
        this(code, message, details, null);
    }

    public TsProxyException(int code, String message, String details, Throwable error) {
        super(message, error);
        this.code = code;
        this.details = details;
    }

    public int getCode() {
        return code;
    }

    public String getDetails() {
        return details;
    }

    public void addResponseHeader(String name, String value) {
        this.responseHeaders.put(name, value);
    }

    public Map<String, String> getResponseHeaders() {
        return this.responseHeaders;
    }
}

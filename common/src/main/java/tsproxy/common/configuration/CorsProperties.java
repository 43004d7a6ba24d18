package tsproxy.common.configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class CorsProperties {

    private boolean enabled = false;
    private boolean allowAnyOrigin = true;
    private boolean allowNullOrigin = false;
    private List<String> allowedOrigins = new ArrayList<>();
    private List<String> allowedMethods = new ArrayList<>(Arrays.asList("GET", "POST", "OPTIONS"));
    private List<String> allowedHeaders = new ArrayList<>(Arrays.asList("content-type"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAllowAnyOrigin() {
        return allowAnyOrigin;
    }

    public void setAllowAnyOrigin(boolean allowAnyOrigin) {
        this.allowAnyOrigin = allowAnyOrigin;
    }

    public boolean isAllowNullOrigin() {
        return allowNullOrigin;
    }

    public void setAllowNullOrigin(boolean allowNullOrigin) {
        this.allowNullOrigin = allowNullOrigin;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public List<String> getAllowedMethods() {
        return allowedMethods;
    }

    public void setAllowedMethods(List<String> allowedMethods) {
        this.allowedMethods = allowedMethods;
    }

    public List<String> getAllowedHeaders() {
        return allowedHeaders;
    }

    public void setAllowedHeaders(List<String> allowedHeaders) {
        this.allowedHeaders = allowedHeaders;
    }
}

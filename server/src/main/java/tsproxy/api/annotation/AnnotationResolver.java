package tsproxy.api.annotation;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tsproxy.api.request.HttpGetRequest;
import tsproxy.api.request.HttpPostRequest;
import tsproxy.api.request.QueryRequest;
import tsproxy.api.request.VersionRequest;

public class AnnotationResolver {

    private static final Logger LOG = LoggerFactory.getLogger(AnnotationResolver.class);
    private static final List<Class<?>> httpClasses = Arrays.asList(QueryRequest.class, VersionRequest.class);

    private AnnotationResolver() {
    }

    public static HttpGetRequest getClassForHttpGet(String path) throws Exception {
        LOG.trace("Looking for class that support http get at path: {}", path);
        for (Class<?> c : httpClasses) {
            Http http = c.getAnnotation(Http.class);
            if (http.path().equals(path) && (HttpGetRequest.class.isAssignableFrom(c))) {
                Object o = c.getDeclaredConstructor().newInstance();
                LOG.trace("Returning: {}", c.getName());
                return (HttpGetRequest) o;
            }
        }
        return null;
    }

    public static HttpPostRequest getClassForHttpPost(String path) throws Exception {
        LOG.trace("Looking for class that support http post at path: {}", path);
        for (Class<?> c : httpClasses) {
            Http http = c.getAnnotation(Http.class);
            if (http.path().equals(path) && (HttpPostRequest.class.isAssignableFrom(c))) {
                Object o = c.getDeclaredConstructor().newInstance();
                LOG.trace("Returning: {}", c.getName());
                return (HttpPostRequest) o;
            }
        }
        return null;
    }

}

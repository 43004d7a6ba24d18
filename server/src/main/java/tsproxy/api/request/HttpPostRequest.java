package tsproxy.api.request;

public interface HttpPostRequest extends HttpRequest {

    public HttpPostRequest parseBody(String content) throws Exception;

}

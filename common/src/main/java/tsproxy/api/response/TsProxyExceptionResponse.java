package tsproxy.api.response;

import java.io.Serializable;

public class TsProxyExceptionResponse implements Serializable {

    private static final long serialVersionUID = 3127049846214713985L;

    public String message;
    public String detailMessage;
    public int responseCode;

    public TsProxyExceptionResponse(TsProxyException e) {
        this.message = e.getMessage();
        this.detailMessage = e.getDetails();
        this.responseCode = e.getCode();
    }
}

package com.slb.update_backend.common.exception;

public class BizException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // HTTP 语义的错误码：400/403/404/409/503
    private final int code;

    public BizException(String message) {
        super(message);
        this.code = 400; // 默认400 - 参数或业务错误
    }

    public BizException(int code, String message) {
        super(message);
        this.code = code;
    }

    public BizException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static BizException notFound(String resource, Object identifier) {
        return new BizException(404, resource + " '" + identifier + "' was not found");
    }

    public static BizException conflict(String message) {
        return new BizException(409, message);
    }
}

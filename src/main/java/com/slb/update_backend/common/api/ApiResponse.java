package com.slb.update_backend.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.slb.update_backend.common.trace.TraceIdHolder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 统一响应封装结构 / Unified API response envelope.
 *
 * <p>Tauri updater 的 manifest 是唯一的例外：它必须返回裸 JSON。</p>
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "统一响应结构，管理端 / CI 接口（成功或异常）均返回该结构 / Unified response envelope used by admin and CI APIs.")
public class ApiResponse<T> {

    @Schema(description = "业务状态码，0 表示成功，非 0 时与 HTTP 状态码一致。/ 0 on success, otherwise the HTTP status.", example = "0")
    private int code;

    @Schema(description = "提示信息；成功时为 'ok'，失败时为具体错误原因。/ 'ok' or the error reason.", example = "ok")
    private String message;

    @Schema(description = "业务数据载体。/ Business payload.", nullable = true)
    private T data;

    @Schema(description = "请求链路追踪 ID。/ Trace identifier for request correlation.", example = "b3f7e6c9a1d24c31")
    private String traceId;

    @Schema(description = "错误扩展信息（可选）。/ Optional structured error details.", nullable = true)
    private ErrorBody error;

    private ApiResponse(int code, String message, T data, String traceId) {
        this.code = code;
        this.message = message;
        this.data = data;
        this.traceId = traceId;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(0, "ok", data, TraceIdHolder.require());
    }

    public static ApiResponse<Void> ok() {
        return ok(null);
    }

    public static ApiResponse<Void> error(int code, String message) {
        return new ApiResponse<>(code, message, null, TraceIdHolder.require());
    }

    /**
     * 带稳定机器码的错误返回，例如 VALIDATION_ERROR / RATE_LIMIT_EXCEEDED。
     */
    public static ApiResponse<Void> error(int httpStatus, String machineCode, String message,
                                          Map<String, String> errors) {
        ApiResponse<Void> resp = error(httpStatus, message);
        resp.setError(new ErrorBody(machineCode, errors, null));
        return resp;
    }

    public static ApiResponse<Void> rateLimited(String message, long retryAfterSeconds) {
        ApiResponse<Void> resp = error(429, message);
        resp.setError(new ErrorBody("RATE_LIMIT_EXCEEDED", null, retryAfterSeconds));
        return resp;
    }

    @Data
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "错误扩展结构 / Structured error details.")
    public static class ErrorBody {
        @Schema(description = "稳定机器错误码 / Stable machine-readable error code.", example = "VALIDATION_ERROR")
        private String code;

        @Schema(description = "字段级错误明细（可选）/ Field-level errors (optional).", nullable = true)
        private Map<String, String> errors;

        @Schema(description = "限流时建议的重试秒数 / Seconds until the rate limit window resets.", nullable = true)
        private Long retryAfter;

        public ErrorBody(String code, Map<String, String> errors, Long retryAfter) {
            this.code = code;
            this.errors = errors;
            this.retryAfter = retryAfter;
        }
    }
}

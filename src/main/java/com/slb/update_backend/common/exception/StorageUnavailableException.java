package com.slb.update_backend.common.exception;

/**
 * 存储协作方（数据库）不可用。与 “not found” 严格区分，对外映射为 503，
 * 绝不能被当作 “没有更新” 处理。
 */
public class StorageUnavailableException extends BizException {

    private static final long serialVersionUID = 1L;

    public StorageUnavailableException(String message, Throwable cause) {
        super(503, message, cause);
    }
}

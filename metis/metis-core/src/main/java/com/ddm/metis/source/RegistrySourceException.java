package com.ddm.metis.source;

/**
 * 后端存储不可用：文件缺失、I/O 错误、SQL 错误、HTTP 非成功响应或超时。
 *
 * <p>在 {@code load()} 中由回退链吸收，不会抛给调用方；写穿（write-through）操作会直接抛出。
 *
 * @author metis
 * @since 1.0
 */
public class RegistrySourceException extends IllegalStateException {

    public RegistrySourceException(String message) {
        super(message);
    }

    public RegistrySourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ddm.metis.provider;

/**
 * 单个 Provider 初始化彻底失败：回退链全部不可用，且默认数据不可用或无法构造。
 *
 * <p>只影响抛出它的 Provider，工厂会记录失败并继续初始化其余 Provider。
 *
 * @author metis
 * @since 1.0
 */
public class RegistryLoadException extends IllegalStateException {

    public RegistryLoadException(String message) {
        super(message);
    }

    public RegistryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

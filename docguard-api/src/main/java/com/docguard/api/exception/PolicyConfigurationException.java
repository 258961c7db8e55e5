package com.docguard.api.exception;

/**
 * 策略配置异常
 * 策略清单无法读取、解析或编译时抛出，只会发生在加载阶段。
 */
public class PolicyConfigurationException extends DocGuardException {

    private final String source;

    public PolicyConfigurationException(String source, String message) {
        super(message);
        this.source = source;
    }

    public PolicyConfigurationException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * 出错的配置来源，如文件路径或 "classpath:docguard/ticket-003.yml"
     */
    public String getSource() {
        return source;
    }
}

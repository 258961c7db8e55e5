package com.docguard.api.exception;

/**
 * 调用契约违规异常
 * <p>
 * 表示调用方传入了不合法的参数（如缺失主体、未知操作），属于上游集成缺陷，
 * 而不是一次安全决策。调用方不应将其与 DENY 混为一谈。
 * </p>
 */
public class PolicyContractException extends DocGuardException {

    private final String paramName;
    private final Object invalidValue;

    public PolicyContractException(String paramName, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = null;
    }

    public PolicyContractException(String paramName, Object invalidValue, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = invalidValue;
    }

    public String getParamName() {
        return paramName;
    }

    public Object getInvalidValue() {
        return invalidValue;
    }
}

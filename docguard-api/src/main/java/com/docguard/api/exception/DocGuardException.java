package com.docguard.api.exception;

/**
 * DocGuard 异常基类
 * 所有引擎抛出的异常均为非受检异常。
 *
 * @author DocGuard
 */
public class DocGuardException extends RuntimeException {

    public DocGuardException(String message) {
        super(message);
    }

    public DocGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.claude.warehouse.service;

/**
 * Silver 파이프라인을 시작하거나 결과를 확인할 수 없을 때 발생
 */
public class SilverLoadException extends RuntimeException {

    public SilverLoadException(String message) {
        super(message);
    }

    public SilverLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.mvccdb.api.exception;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Session 不存在或已关闭: " + sessionId);
    }
}

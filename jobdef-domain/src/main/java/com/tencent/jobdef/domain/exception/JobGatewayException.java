package com.tencent.jobdef.domain.exception;

/**
 * JobGatewayException - 远程作业系统调用失败
 *
 * @author jobdef
 */
public class JobGatewayException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public JobGatewayException(String message) {
        super(message);
    }

    public JobGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}

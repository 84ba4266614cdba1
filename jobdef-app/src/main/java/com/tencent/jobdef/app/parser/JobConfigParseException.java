package com.tencent.jobdef.app.parser;

/**
 * JobConfigParseException - 作业配置文档无法解析
 *
 * @author jobdef
 */
public class JobConfigParseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public JobConfigParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

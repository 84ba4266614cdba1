package com.tencent.jobdef.adapter.web;

import com.tencent.jobdef.app.parser.JobConfigParseException;
import com.tencent.jobdef.client.dto.Response;
import com.tencent.jobdef.domain.exception.JobGatewayException;
import com.tencent.jobdef.domain.exception.JobNotFoundException;
import com.tencent.jobdef.domain.exception.JobTranslationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * GlobalExceptionHandler - 全局异常处理器
 * <p>
 * 翻译失败与参数校验失败返回 400，作业不存在返回 404，远程调用失败返回 502。
 * 错误码为异常对应的错误码名称。
 * </p>
 *
 * @author jobdef
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    static final String PARSE_ERROR = "PARSE_ERROR";
    static final String JOB_NOT_FOUND = "JOB_NOT_FOUND";
    static final String GATEWAY_ERROR = "GATEWAY_ERROR";
    static final String INTERNAL_SERVER_ERROR = "INTERNAL_SERVER_ERROR";

    @ExceptionHandler(JobTranslationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response handleTranslationException(JobTranslationException e) {
        log.warn("Job translation failed [{}]: {}", e.getErrorCode(), e.getMessage());
        return Response.buildFailure(e.getErrorCode().name(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .collect(Collectors.joining("; "));
        log.warn("Validation failed: {}", message);
        return Response.buildFailure(VALIDATION_ERROR, message);
    }

    @ExceptionHandler({JobConfigParseException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response handleParseException(RuntimeException e) {
        log.warn("Failed to read job document: {}", e.getMessage());
        return Response.buildFailure(PARSE_ERROR, e.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Response handleNotFound(JobNotFoundException e) {
        log.info("Job not found: {}", e.getJobId());
        return Response.buildFailure(JOB_NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(JobGatewayException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Response handleGatewayException(JobGatewayException e) {
        log.error("Rundeck call failed: {}", e.getMessage(), e);
        return Response.buildFailure(GATEWAY_ERROR, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response handleException(Exception e) {
        log.error("Unhandled exception occurred: {}", e.getMessage(), e);
        return Response.buildFailure(INTERNAL_SERVER_ERROR,
            e.getMessage() != null ? e.getMessage() : "服务器内部错误");
    }
}

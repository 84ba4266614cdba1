package com.tencent.jobdef.client.dto;

import lombok.Data;

import java.io.Serializable;

/**
 * Response - 接口响应
 * <p>
 * 失败时 errCode 取错误码名称（如 TOO_MANY_BLOCKS、JOB_NOT_FOUND），errMessage 为可读的错误信息。
 * </p>
 *
 * @author jobdef
 */
@Data
public class Response implements Serializable {
    private static final long serialVersionUID = 1L;

    private boolean success = true;
    private String errCode;
    private String errMessage;

    public static Response buildSuccess() {
        Response response = new Response();
        response.setSuccess(true);
        return response;
    }

    public static Response buildFailure(String errCode, String errMessage) {
        Response response = new Response();
        response.setSuccess(false);
        response.setErrCode(errCode);
        response.setErrMessage(errMessage);
        return response;
    }
}

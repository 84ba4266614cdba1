package com.tencent.jobdef.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * SingleResponse - 携带单个数据对象的响应，如作业的扁平配置
 *
 * @author jobdef
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class SingleResponse<T> extends Response {
    private T data;

    public static <T> SingleResponse<T> of(T data) {
        SingleResponse<T> response = new SingleResponse<>();
        response.setSuccess(true);
        response.setData(data);
        return response;
    }
}

package com.tencent.jobdef.domain.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * WebHookNotification - WebHook 通知
 * <p>
 * URL 列表至少包含一个地址。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebHookNotification {

    @Builder.Default
    private List<String> urls = new ArrayList<>();

    /**
     * 请求方法："get" 或 "post"
     */
    private String httpMethod;

    /**
     * 请求体格式："xml" 或 "json"
     */
    private String format;
}

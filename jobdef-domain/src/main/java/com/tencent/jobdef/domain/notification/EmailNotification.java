package com.tencent.jobdef.domain.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * EmailNotification - 邮件通知
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailNotification {

    /**
     * 是否附带执行日志
     */
    private boolean attachLog;

    /**
     * 收件人列表
     */
    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    private String subject;
}

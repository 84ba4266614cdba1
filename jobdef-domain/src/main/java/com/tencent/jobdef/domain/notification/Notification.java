package com.tencent.jobdef.domain.notification;

import com.tencent.jobdef.domain.plugin.JobPlugin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Notification - 某一触发类型下的通知
 * <p>
 * 邮件、WebHook、插件三种载荷都是可选的，插件最多一个。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    private EmailNotification email;

    private WebHookNotification webHook;

    private JobPlugin plugin;
}

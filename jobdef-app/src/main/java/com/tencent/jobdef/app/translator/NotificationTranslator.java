package com.tencent.jobdef.app.translator;

import com.tencent.jobdef.client.dto.config.EmailConfigDto;
import com.tencent.jobdef.client.dto.config.NotificationConfigDto;
import com.tencent.jobdef.client.dto.config.PluginConfigDto;
import com.tencent.jobdef.domain.exception.JobTranslationException;
import com.tencent.jobdef.domain.notification.EmailNotification;
import com.tencent.jobdef.domain.notification.Notification;
import com.tencent.jobdef.domain.notification.NotificationSet;
import com.tencent.jobdef.domain.notification.TriggerType;
import com.tencent.jobdef.domain.notification.WebHookNotification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * NotificationTranslator - 通知翻译器
 * <p>
 * 最多三个 notification 配置块，每种触发类型一个。
 * 配置块中的 email 只取第一个；webhook_urls 非空时才生成 WebHook 通知。
 * </p>
 *
 * @author jobdef
 */
public final class NotificationTranslator {

    private static final int MAX_BLOCKS = TriggerType.values().length;

    private NotificationTranslator() {
    }

    /**
     * 配置块转领域对象
     *
     * @return 没有配置块时返回 null
     * @throws JobTranslationException 配置块超过三个、触发类型未知或重复、插件超过一个
     */
    public static NotificationSet toDomain(List<NotificationConfigDto> blocks) {
        if (blocks == null || blocks.isEmpty()) {
            return null;
        }
        if (blocks.size() > MAX_BLOCKS) {
            throw JobTranslationException.tooManyNotificationBlocks(blocks.size());
        }

        NotificationSet notifications = new NotificationSet();
        for (NotificationConfigDto block : blocks) {
            Notification notification = notificationToDomain(block);
            TriggerType type = TriggerType.fromValue(block.getType());
            if (notifications.get(type) != null) {
                throw JobTranslationException.duplicateNotificationType(type.getValue());
            }
            notifications.put(type, notification);
        }
        return notifications;
    }

    /**
     * 领域对象转配置块，按 on_success、on_failure、on_start 的顺序输出
     *
     * @return 没有任何通知时返回 null
     */
    public static List<NotificationConfigDto> toConfig(NotificationSet notifications) {
        if (notifications == null || notifications.isEmpty()) {
            return null;
        }

        List<NotificationConfigDto> blocks = new ArrayList<>();
        for (TriggerType type : TriggerType.values()) {
            Notification notification = notifications.get(type);
            if (notification != null) {
                blocks.add(notificationToConfig(type, notification));
            }
        }
        return blocks;
    }

    private static Notification notificationToDomain(NotificationConfigDto block) {
        Notification notification = new Notification();

        if (block.getEmail() != null && !block.getEmail().isEmpty()) {
            EmailConfigDto email = block.getEmail().get(0);
            notification.setEmail(EmailNotification.builder()
                .attachLog(email.isAttachLog())
                .recipients(email.getRecipients() != null
                    ? new ArrayList<>(email.getRecipients())
                    : new ArrayList<>())
                .subject(email.getSubject())
                .build());
        }

        if (block.getWebhookUrls() != null && !block.getWebhookUrls().isEmpty()) {
            notification.setWebHook(WebHookNotification.builder()
                .urls(new ArrayList<>(block.getWebhookUrls()))
                .httpMethod(block.getWebhookHttpMethod())
                .format(block.getWebhookFormat())
                .build());
        }

        List<PluginConfigDto> plugins = block.getPlugin();
        if (plugins != null && plugins.size() > 1) {
            throw JobTranslationException.tooManyNotificationPlugins(block.getType());
        }
        if (plugins != null && !plugins.isEmpty()) {
            notification.setPlugin(CommandTranslator.pluginToDomain(plugins.get(0)));
        }
        return notification;
    }

    private static NotificationConfigDto notificationToConfig(TriggerType type, Notification notification) {
        NotificationConfigDto block = NotificationConfigDto.builder()
            .type(type.getValue())
            .build();

        WebHookNotification webHook = notification.getWebHook();
        if (webHook != null) {
            block.setWebhookUrls(new ArrayList<>(webHook.getUrls()));
            block.setWebhookHttpMethod(webHook.getHttpMethod());
            block.setWebhookFormat(webHook.getFormat());
        }

        EmailNotification email = notification.getEmail();
        if (email != null) {
            block.setEmail(Collections.singletonList(EmailConfigDto.builder()
                .attachLog(email.isAttachLog())
                .recipients(new ArrayList<>(email.getRecipients()))
                .subject(email.getSubject())
                .build()));
        }

        if (notification.getPlugin() != null) {
            block.setPlugin(Collections.singletonList(CommandTranslator.pluginToConfig(notification.getPlugin())));
        }
        return block;
    }
}

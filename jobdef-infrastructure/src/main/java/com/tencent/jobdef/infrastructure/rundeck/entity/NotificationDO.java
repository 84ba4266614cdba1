package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

/**
 * NotificationDO - 通知 &lt;notification&gt;
 * <p>
 * 收件人与 WebHook 地址在文档中以逗号拼接；WebHook 的请求方法与格式挂在触发类型元素上。
 * </p>
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationDO {

    @JacksonXmlProperty(localName = "onsuccess")
    private Trigger onSuccess;

    @JacksonXmlProperty(localName = "onfailure")
    private Trigger onFailure;

    @JacksonXmlProperty(localName = "onstart")
    private Trigger onStart;

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Trigger {
        @JacksonXmlProperty(isAttribute = true, localName = "httpMethod")
        private String httpMethod;
        @JacksonXmlProperty(isAttribute = true, localName = "format")
        private String format;
        @JacksonXmlProperty(localName = "email")
        private Email email;
        @JacksonXmlProperty(localName = "webhook")
        private WebHook webHook;
        @JacksonXmlProperty(localName = "plugin")
        private PluginDO plugin;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Email {
        @JacksonXmlProperty(isAttribute = true, localName = "attachLog")
        private Boolean attachLog;
        @JacksonXmlProperty(isAttribute = true, localName = "recipients")
        private String recipients;
        @JacksonXmlProperty(isAttribute = true, localName = "subject")
        private String subject;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WebHook {
        @JacksonXmlProperty(isAttribute = true, localName = "urls")
        private String urls;
    }
}

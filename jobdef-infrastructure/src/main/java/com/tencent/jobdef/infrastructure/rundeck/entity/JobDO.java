package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

/**
 * JobDO - Rundeck 作业数据对象 &lt;job&gt;
 * <p>
 * 与 Rundeck 作业 XML 格式一一对应，只在基础设施层使用。
 * </p>
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "uuid", "name", "group", "description", "context", "executionEnabled",
    "scheduleEnabled", "timeZone", "timeout", "loglevel", "multipleExecutions", "retry", "dispatch",
    "nodefilters", "schedule", "sequence", "notification"})
public class JobDO {

    @JacksonXmlProperty(localName = "id")
    private String id;

    /**
     * 与 id 相同，导入时配合 uuidOption=preserve 保留作业标识
     */
    @JacksonXmlProperty(localName = "uuid")
    private String uuid;

    @JacksonXmlProperty(localName = "name")
    private String name;

    @JacksonXmlProperty(localName = "group")
    private String group;

    @JacksonXmlProperty(localName = "description")
    private String description;

    @JacksonXmlProperty(localName = "context")
    private ContextDO context;

    /**
     * 缺省时 Rundeck 视为 true
     */
    @JacksonXmlProperty(localName = "executionEnabled")
    private Boolean executionEnabled;

    /**
     * 缺省时 Rundeck 视为 true
     */
    @JacksonXmlProperty(localName = "scheduleEnabled")
    private Boolean scheduleEnabled;

    @JacksonXmlProperty(localName = "timeZone")
    private String timeZone;

    @JacksonXmlProperty(localName = "timeout")
    private String timeout;

    @JacksonXmlProperty(localName = "loglevel")
    private String logLevel;

    @JacksonXmlProperty(localName = "multipleExecutions")
    private Boolean multipleExecutions;

    @JacksonXmlProperty(localName = "retry")
    private String retry;

    @JacksonXmlProperty(localName = "dispatch")
    private DispatchDO dispatch;

    @JacksonXmlProperty(localName = "nodefilters")
    private NodeFilterDO nodeFilter;

    @JacksonXmlProperty(localName = "schedule")
    private ScheduleDO schedule;

    @JacksonXmlProperty(localName = "sequence")
    private SequenceDO sequence;

    @JacksonXmlProperty(localName = "notification")
    private NotificationDO notification;
}

package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

/**
 * ScheduleDO - 调度 &lt;schedule&gt;，各字段均为 XML 属性
 * <p>
 * 例如 &lt;time seconds="0" minute="0" hour="12"/&gt;&lt;month day="?" month="*"/&gt;
 * &lt;weekday day="MON"/&gt;&lt;year year="*"/&gt;
 * </p>
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScheduleDO {

    @JacksonXmlProperty(localName = "time")
    private Time time;

    @JacksonXmlProperty(localName = "month")
    private Month month;

    @JacksonXmlProperty(localName = "weekday")
    private WeekDay weekDay;

    @JacksonXmlProperty(localName = "year")
    private Year year;

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Time {
        @JacksonXmlProperty(isAttribute = true, localName = "seconds")
        private String seconds;
        @JacksonXmlProperty(isAttribute = true, localName = "minute")
        private String minute;
        @JacksonXmlProperty(isAttribute = true, localName = "hour")
        private String hour;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Month {
        @JacksonXmlProperty(isAttribute = true, localName = "day")
        private String day;
        @JacksonXmlProperty(isAttribute = true, localName = "month")
        private String month;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class WeekDay {
        @JacksonXmlProperty(isAttribute = true, localName = "day")
        private String day;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Year {
        @JacksonXmlProperty(isAttribute = true, localName = "year")
        private String year;
    }
}

package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

/**
 * OptionDO - 作业选项 &lt;option&gt;
 * <p>
 * 可选值列表 values 在文档中以逗号拼接。
 * </p>
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OptionDO {

    @JacksonXmlProperty(isAttribute = true, localName = "name")
    private String name;

    @JacksonXmlProperty(isAttribute = true, localName = "label")
    private String label;

    /**
     * 默认值
     */
    @JacksonXmlProperty(isAttribute = true, localName = "value")
    private String defaultValue;

    @JacksonXmlProperty(isAttribute = true, localName = "values")
    private String values;

    @JacksonXmlProperty(isAttribute = true, localName = "valuesUrl")
    private String valuesUrl;

    @JacksonXmlProperty(isAttribute = true, localName = "enforcedvalues")
    private Boolean enforcedValues;

    @JacksonXmlProperty(isAttribute = true, localName = "regex")
    private String regex;

    @JacksonXmlProperty(isAttribute = true, localName = "required")
    private Boolean required;

    @JacksonXmlProperty(isAttribute = true, localName = "multivalued")
    private Boolean multivalued;

    @JacksonXmlProperty(isAttribute = true, localName = "delimiter")
    private String delimiter;

    @JacksonXmlProperty(isAttribute = true, localName = "secure")
    private Boolean secure;

    @JacksonXmlProperty(isAttribute = true, localName = "valueExposed")
    private Boolean valueExposed;

    @JacksonXmlProperty(isAttribute = true, localName = "storagePath")
    private String storagePath;

    @JacksonXmlProperty(isAttribute = true, localName = "isDate")
    private Boolean date;

    @JacksonXmlProperty(isAttribute = true, localName = "dateFormat")
    private String dateFormat;

    @JacksonXmlProperty(localName = "description")
    private String description;
}

package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

import java.util.List;

/**
 * OptionsDO - &lt;options&gt;
 *
 * @author jobdef
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OptionsDO {

    @JacksonXmlProperty(isAttribute = true, localName = "preserveOrder")
    private Boolean preserveOrder;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "option")
    private List<OptionDO> options;
}

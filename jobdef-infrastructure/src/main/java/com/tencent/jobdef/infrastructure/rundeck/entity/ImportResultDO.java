package com.tencent.jobdef.infrastructure.rundeck.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * ImportResultDO - 作业导入接口的 JSON 返回结果
 *
 * @author jobdef
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImportResultDO {

    private List<ImportedJob> succeeded = new ArrayList<>();

    private List<ImportedJob> failed = new ArrayList<>();

    private List<ImportedJob> skipped = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ImportedJob {
        private Integer index;
        private String id;
        private String name;
        private String group;
        private String project;
        /**
         * 导入失败时的错误信息
         */
        private String error;
    }
}

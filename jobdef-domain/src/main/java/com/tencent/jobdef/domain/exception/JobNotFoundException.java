package com.tencent.jobdef.domain.exception;

/**
 * JobNotFoundException - 远程作业系统中不存在指定 ID 的作业
 *
 * @author jobdef
 */
public class JobNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}

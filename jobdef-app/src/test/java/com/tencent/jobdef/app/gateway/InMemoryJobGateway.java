package com.tencent.jobdef.app.gateway;

import com.tencent.jobdef.domain.gateway.JobGateway;
import com.tencent.jobdef.domain.job.Job;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 内存作业网关，测试用
 * <p>
 * 保存时丢弃分发策略，模拟远程系统不回传 dispatch 的情况。
 * </p>
 */
public class InMemoryJobGateway implements JobGateway {

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private int sequence = 0;

    @Override
    public Optional<Job> getJob(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public String createJob(Job job) {
        String id = "job-" + (++sequence);
        job.setId(id);
        store(job);
        return id;
    }

    @Override
    public String updateJob(Job job) {
        if (job.getId() == null) {
            throw new IllegalArgumentException("Job id is required for update");
        }
        store(job);
        return job.getId();
    }

    @Override
    public void deleteJob(String id) {
        jobs.remove(id);
    }

    public Map<String, Job> getJobs() {
        return jobs;
    }

    private void store(Job job) {
        if (job.getDispatch() != null && job.getDispatch().getThreadCount() <= 1) {
            job.setDispatch(null);
        }
        jobs.put(job.getId(), job);
    }
}

package com.tencent.jobdef.domain.gateway;

import com.tencent.jobdef.domain.job.Job;

import java.util.Optional;

/**
 * JobGateway - 远程作业系统网关
 * <p>
 * 领域层通过该接口访问远程作业调度系统，实现位于基础设施层。
 * 重试、缓存和超时均由实现方负责。
 * </p>
 *
 * @author jobdef
 */
public interface JobGateway {

    /**
     * 按 ID 获取作业
     *
     * @return 作业不存在时为空
     * @throws com.tencent.jobdef.domain.exception.JobGatewayException 传输失败
     */
    Optional<Job> getJob(String id);

    /**
     * 创建作业
     *
     * @return 远程系统分配的作业 ID
     */
    String createJob(Job job);

    /**
     * 更新作业，job.id 必须已设置
     *
     * @return 作业 ID
     */
    String updateJob(Job job);

    /**
     * 删除作业
     */
    void deleteJob(String id);
}

package com.tencent.jobdef.domain.job;

import com.tencent.jobdef.domain.command.Command;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * CommandSequence - 命令序列
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandSequence {

    /**
     * 顶层命令列表，顺序即执行顺序
     */
    @Builder.Default
    private List<Command> commands = new ArrayList<>();

    @Builder.Default
    private OrderingStrategy strategy = OrderingStrategy.NODE_FIRST;

    /**
     * 某个步骤失败后是否继续执行后续步骤
     */
    private boolean keepGoing;

    /**
     * 全局日志过滤器（可选），未设置时为 null
     */
    private List<LogFilter> globalLogFilters;
}

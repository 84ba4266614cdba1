package com.tencent.jobdef.domain.command;

import com.tencent.jobdef.domain.plugin.JobPlugin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Command - 作业步骤
 * <p>
 * 执行形式为 shell 命令、内联脚本、脚本文件三者之一；三者同时设置时不做校验，原样传递。
 * 错误处理器本身也是一个 Command，但它不会再有自己的错误处理器，
 * 嵌套深度最多两层。
 * </p>
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Command {

    /**
     * 步骤描述
     */
    private String description;

    /**
     * shell 命令
     */
    private String shellCommand;

    /**
     * 内联脚本内容
     */
    private String inlineScript;

    /**
     * 脚本文件路径
     */
    private String scriptFile;

    /**
     * 脚本文件参数
     */
    private String scriptFileArgs;

    /**
     * 脚本解释器（可选）
     */
    private ScriptInterpreter scriptInterpreter;

    /**
     * 作业引用（可选）
     */
    private JobReference jobReference;

    /**
     * 步骤插件（可选）
     */
    private JobPlugin stepPlugin;

    /**
     * 节点步骤插件（可选）
     */
    private JobPlugin nodeStepPlugin;

    /**
     * 其他节点成功时是否继续
     */
    private boolean keepGoingOnSuccess;

    /**
     * 错误处理器（可选）
     */
    private Command errorHandler;
}

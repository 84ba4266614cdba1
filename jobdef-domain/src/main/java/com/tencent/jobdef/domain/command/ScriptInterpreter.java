package com.tencent.jobdef.domain.command;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ScriptInterpreter - 脚本解释器
 *
 * @author jobdef
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScriptInterpreter {

    /**
     * 调用字符串，如 "sudo -u deploy bash"
     */
    private String invocationString;

    /**
     * 脚本与参数是否作为一个整体加引号传给解释器
     */
    private boolean argsQuoted;
}

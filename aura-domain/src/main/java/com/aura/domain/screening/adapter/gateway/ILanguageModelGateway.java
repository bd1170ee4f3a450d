package com.aura.domain.screening.adapter.gateway;

import com.aura.domain.screening.model.valobj.ModelOutcome;

/**
 * 生成式文本服务端口。
 */
public interface ILanguageModelGateway {

    /**
     * 以固定温度与输出上限调用模型，阻塞直到上游返回。
     * 实现不得抛出异常，所有失败都需要归类到 {@link ModelOutcome}。
     *
     * @param prompt 提示词
     * @return 分类后的调用结果
     */
    ModelOutcome invoke(String prompt);
}

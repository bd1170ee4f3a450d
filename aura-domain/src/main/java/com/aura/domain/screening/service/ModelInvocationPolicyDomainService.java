package com.aura.domain.screening.service;

import com.aura.domain.screening.model.valobj.ModelOutcome;
import org.springframework.stereotype.Service;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 模型调用策略领域服务：两级提示词重试。
 * <p>
 * 仅当完整版提示词被拒答时，使用精简版提示词再调用一次；
 * 上游错误、空输出或第二次调用的任何失败都直接返回，不再重试。
 * </p>
 */
@Service
public class ModelInvocationPolicyDomainService {

    public InvocationResult invokeWithSimplifiedRetry(String primaryPrompt,
                                                      Supplier<String> simplifiedPrompt,
                                                      Function<String, ModelOutcome> invoker) {
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        ModelOutcome first = invoker.apply(primaryPrompt);
        if (first == null) {
            first = ModelOutcome.upstreamError("Model invoker returned no outcome");
        }
        if (!first.isRefused() || simplifiedPrompt == null) {
            return new InvocationResult(first, 1, false, first.getDetail());
        }

        ModelOutcome second = invoker.apply(simplifiedPrompt.get());
        if (second == null) {
            second = ModelOutcome.upstreamError("Model invoker returned no outcome");
        }
        return new InvocationResult(second, 2, true, first.getDetail());
    }

    /**
     * @param outcome 最终采用的调用结果
     * @param attempts 实际调用次数
     * @param simplifiedUsed 是否使用了精简版提示词
     * @param firstAttemptDetail 第一次调用的失败描述
     */
    public record InvocationResult(ModelOutcome outcome,
                                   int attempts,
                                   boolean simplifiedUsed,
                                   String firstAttemptDetail) {

        public boolean refusedOnAllTiers() {
            return outcome.isRefused();
        }
    }
}

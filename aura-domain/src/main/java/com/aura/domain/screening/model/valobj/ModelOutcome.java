package com.aura.domain.screening.model.valobj;

import com.aura.types.enums.InvocationStatusEnum;
import lombok.Getter;

/**
 * 一次模型调用的分类结果。
 * <p>
 * SUCCESS 的文本保证非空白；拒答、上游错误与空输出分别携带原因描述。
 * </p>
 */
@Getter
public final class ModelOutcome {

    private final InvocationStatusEnum status;
    private final String text;
    private final String detail;

    private ModelOutcome(InvocationStatusEnum status, String text, String detail) {
        this.status = status;
        this.text = text;
        this.detail = detail;
    }

    public static ModelOutcome success(String text) {
        if (text == null || text.trim().isEmpty()) {
            return emptyOutput();
        }
        return new ModelOutcome(InvocationStatusEnum.SUCCESS, text, null);
    }

    public static ModelOutcome refused(String reason) {
        return new ModelOutcome(InvocationStatusEnum.REFUSED, null, reason);
    }

    public static ModelOutcome upstreamError(String detail) {
        return new ModelOutcome(InvocationStatusEnum.UPSTREAM_ERROR, null, detail);
    }

    public static ModelOutcome emptyOutput() {
        return new ModelOutcome(InvocationStatusEnum.EMPTY_OUTPUT, null, "Model returned no usable text");
    }

    public boolean isSuccess() {
        return status == InvocationStatusEnum.SUCCESS;
    }

    public boolean isRefused() {
        return status == InvocationStatusEnum.REFUSED;
    }

    @Override
    public String toString() {
        return "ModelOutcome{status=" + status
                + ", textLength=" + (text == null ? 0 : text.length())
                + ", detail='" + detail + "'}";
    }
}

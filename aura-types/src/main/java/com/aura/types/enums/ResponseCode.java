package com.aura.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息。
 * 0002/0003 为调用方错误，不重试；0004~0006 为上游模型相关错误。
 * </p>
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "Success"),

    /** 未知错误 */
    UN_ERROR("0001", "Unexpected internal error"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "Invalid parameter"),

    /** 会话不存在 */
    NOT_FOUND("0003", "Session not found"),

    /** 模型拒绝生成内容（两级提示词均被拒） */
    UPSTREAM_REFUSED("0004", "Content was filtered by the language model"),

    /** 模型服务调用失败 */
    UPSTREAM_FAILURE("0005", "Language model service failure"),

    /** 模型输出无法解析为预期结构 */
    MALFORMED_RESPONSE("0006", "Malformed language model response"),

    /** 上传文件过大 */
    PAYLOAD_TOO_LARGE("0007", "File too large");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}

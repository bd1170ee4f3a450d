package com.aura.types.common;

/**
 * 全局常量定义类。
 */
public class Constants {

    /** 逗号分隔符，用于拼接技能列表 */
    public final static String SPLIT = ", ";

    /** 分数下限 */
    public final static int MIN_SCORE = 0;

    /** 分数上限 */
    public final static int MAX_SCORE = 100;

    /** 面试题数量 */
    public final static int INTERVIEW_QUESTION_COUNT = 4;

    /** 诊断信息中原始/清洗文本预览的最大长度 */
    public final static int DIAGNOSTIC_PREVIEW_LENGTH = 200;

    /** 上传后返回的简历预览长度 */
    public final static int RESUME_PREVIEW_LENGTH = 200;

}

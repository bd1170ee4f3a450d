/**
 * Screening 领域 - 候选人筛选域
 *
 * <p>职责：简历分析、模拟面试与综合评分的会话状态机</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>会话：单个候选人从上传简历到得出录用建议的完整流程</li>
 *   <li>模型编排：两级提示词（详细 -> 简化）应对模型拒答</li>
 *   <li>结构化修复：从模型自由文本中恢复 JSON 并做形状校验与分数钳制</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.aura.domain.screening.model.entity.ScreeningSessionEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>TextSanitizerDomainService - 模型输出清洗</li>
 *   <li>ScreeningPromptDomainService - 提示词构建</li>
 *   <li>ModelInvocationPolicyDomainService - 拒答重试策略</li>
 *   <li>StructuredResultDomainService - 结构化解析与兜底</li>
 *   <li>ScoringAggregationDomainService - 最终评分聚合</li>
 * </ul>
 */
package com.aura.domain.screening;

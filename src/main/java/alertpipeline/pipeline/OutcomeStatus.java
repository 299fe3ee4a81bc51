package alertpipeline.pipeline;

/**
 * raise 的处理结果
 */
public enum OutcomeStatus {
    DELIVERED,
    PARTIALLY_DELIVERED,
    FAILED,
    FILTERED,
    SUPPRESSED,
    QUEUED,
    AGGREGATED,
    ESCALATED,
    /** 背压或管道已停止, 告警未被接收 */
    REJECTED,
    /** 超过 processingTimeout, 后台处理仍会完成 */
    TIMED_OUT
}

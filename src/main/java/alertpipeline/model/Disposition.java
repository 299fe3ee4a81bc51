package alertpipeline.model;

/**
 * 告警在管道中的最终去向, 记录在历史中
 */
public enum Disposition {
    DELIVERED,
    PARTIALLY_DELIVERED,
    FAILED,
    FILTERED,
    SUPPRESSED,
    QUEUED,
    AGGREGATED,
    ESCALATED,
    ACKNOWLEDGED,
    RESOLVED
}

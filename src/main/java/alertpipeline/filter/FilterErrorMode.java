package alertpipeline.filter;

/**
 * 过滤器抛出异常时的处理策略
 */
public enum FilterErrorMode {
    /** 视为放行 */
    ALLOW,
    /** 视为抑制 */
    SUPPRESS,
    /** 记录日志后跳过该过滤器 */
    LOG_AND_CONTINUE,
    /** 连续出错达到上限后禁用该过滤器 */
    DISABLE_AFTER_ERRORS
}

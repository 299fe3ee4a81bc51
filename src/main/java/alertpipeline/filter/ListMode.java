package alertpipeline.filter;

public enum ListMode {
    /** 只放行名单中的来源 */
    WHITELIST,
    /** 抑制名单中的来源 */
    BLACKLIST
}

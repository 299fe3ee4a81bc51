package alertpipeline.model;

/**
 * 参与指纹计算的告警字段
 */
public enum FingerprintField {
    SOURCE,
    MESSAGE,
    SEVERITY,
    TAG
}

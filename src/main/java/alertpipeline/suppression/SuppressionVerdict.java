package alertpipeline.suppression;

import lombok.Value;

/**
 * 抑制判定结果, 携带产生该结果的规则名称和原因
 */
@Value
public class SuppressionVerdict {

    private static final SuppressionVerdict PASS = new SuppressionVerdict(SuppressionAction.PASS, null, null);

    SuppressionAction action;
    String ruleName;
    String reason;

    public static SuppressionVerdict pass() {
        return PASS;
    }

    public static SuppressionVerdict of(SuppressionAction action, String ruleName, String reason) {
        if (action == SuppressionAction.PASS) {
            return PASS;
        }
        return new SuppressionVerdict(action, ruleName, reason);
    }

    public static SuppressionVerdict suppress(String ruleName, String reason) {
        return new SuppressionVerdict(SuppressionAction.SUPPRESS, ruleName, reason);
    }

    public boolean isPass() {
        return action == SuppressionAction.PASS;
    }
}

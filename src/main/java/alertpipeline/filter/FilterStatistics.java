package alertpipeline.filter;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FilterStatistics {
    String filterName;
    int priority;
    long evaluations;
    long allowed;
    long suppressed;
    long modified;
    long errors;
    int consecutiveErrors;
    boolean disabled;
}

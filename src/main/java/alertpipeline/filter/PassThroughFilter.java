package alertpipeline.filter;

import alertpipeline.model.Alert;

public class PassThroughFilter extends AbstractAlertFilter {

    public PassThroughFilter(String name, int priority) {
        super(name, priority);
    }

    @Override
    public FilterDecision evaluate(Alert alert) {
        return FilterDecision.allow();
    }
}

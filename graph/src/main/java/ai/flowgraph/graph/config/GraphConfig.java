package ai.flowgraph.graph.config;

import ai.flowgraph.graph.eval.FanInPolicy;
import ai.flowgraph.graph.eval.UnboundInletPolicy;
import ai.flowgraph.graph.model.Operator;
import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties("flowgraph")
public class GraphConfig {
    private String outletName = Operator.DEFAULT_OUTLET_NAME;
    private Operators operators = new Operators();
    private Evaluation evaluation = new Evaluation();

    @Getter
    @Setter
    @ConfigurationProperties("operators")
    public static class Operators {
        // expression and name prefix of operators created by positional inserts
        private String defaultExpression = "x+y";
        private String namePrefix = "n";
    }

    @Getter
    @Setter
    @ConfigurationProperties("evaluation")
    public static class Evaluation {
        private FanInPolicy fanIn = FanInPolicy.LAST_WINS;
        private UnboundInletPolicy unboundInlets = UnboundInletPolicy.FAIL;
        private String defaultValue = "None";
    }
}

package ai.flowgraph.graph.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.List;
import javax.annotation.Nullable;

@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
@JsonSerialize
@JsonDeserialize
public record GraphSnapshot(
    List<OperatorSnapshot> operators,
    List<LinkSnapshot> links
) {

    @JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
    @JsonSerialize
    @JsonDeserialize
    public record OperatorSnapshot(
        String id,
        String name,
        String expression,
        List<String> inlets,
        String outlet
    ) { }

    /**
     * Link into inlet {@code targetInlet} (ordinal) of operator {@code targetOperator}; a null source
     * operator stands for a pending link. Links are listed in positional order per inlet, and
     * {@code serial} orders them by recency (higher is newer).
     */
    @JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
    @JsonSerialize
    @JsonDeserialize
    public record LinkSnapshot(
        String targetOperator,
        int targetInlet,
        @Nullable String sourceOperator,
        long serial
    ) { }
}

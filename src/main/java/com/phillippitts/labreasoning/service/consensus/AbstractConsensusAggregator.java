package com.phillippitts.labreasoning.service.consensus;

import com.phillippitts.labreasoning.domain.ConsensusMetrics;
import com.phillippitts.labreasoning.domain.ModelDiagnosisInput;

import java.util.List;
import java.util.Map;

/**
 * Base class handling empty and null inputs before delegating to {@link #doAggregate}.
 *
 * <ul>
 *   <li>null lists are treated as empty</li>
 *   <li>both empty: empty outcome with zeroed metrics</li>
 *   <li>otherwise: {@link #doAggregate(List, List)}</li>
 * </ul>
 */
public abstract class AbstractConsensusAggregator implements ConsensusAggregator {

    @Override
    public final ConsensusOutcome aggregate(List<ModelDiagnosisInput> primary, List<ModelDiagnosisInput> challenger) {
        List<ModelDiagnosisInput> p = primary == null ? List.of() : primary;
        List<ModelDiagnosisInput> c = challenger == null ? List.of() : challenger;
        if (p.isEmpty() && c.isEmpty()) {
            return emptyOutcome();
        }
        return doAggregate(p, c);
    }

    /**
     * @param primary    never null
     * @param challenger never null; at least one of the two lists is non-empty
     */
    protected abstract ConsensusOutcome doAggregate(List<ModelDiagnosisInput> primary,
                                                    List<ModelDiagnosisInput> challenger);

    protected final ConsensusOutcome emptyOutcome() {
        return new ConsensusOutcome(List.of(), new ConsensusMetrics(List.of(), 0, 0, 0, List.of(), 0L, Map.of()));
    }
}

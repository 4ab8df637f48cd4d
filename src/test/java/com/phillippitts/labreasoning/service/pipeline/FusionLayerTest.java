package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.config.properties.PipelineProperties;
import com.phillippitts.labreasoning.domain.ConsensusDiagnosis;
import com.phillippitts.labreasoning.domain.ConsensusLevel;
import com.phillippitts.labreasoning.domain.SpecialtyFinding;
import com.phillippitts.labreasoning.domain.TriageResult;
import com.phillippitts.labreasoning.exception.DiagnosisPipelineException;
import com.phillippitts.labreasoning.service.consensus.ReciprocalRankConsensusAggregator;
import com.phillippitts.labreasoning.service.metrics.PipelineMetrics;
import com.phillippitts.labreasoning.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.labreasoning.service.model.ModelCallRequest;
import com.phillippitts.labreasoning.service.parse.SpecialtyResponseParser;
import com.phillippitts.labreasoning.service.parse.TriageResponseParser;
import com.phillippitts.labreasoning.testutil.FakeModelClient;
import com.phillippitts.labreasoning.testutil.LabFixtures;
import com.phillippitts.labreasoning.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static com.phillippitts.labreasoning.testutil.FakeModelClient.CHALLENGER;
import static com.phillippitts.labreasoning.testutil.FakeModelClient.FUSION;
import static com.phillippitts.labreasoning.testutil.LabFixtures.CHALLENGER_REPLY;
import static com.phillippitts.labreasoning.testutil.LabFixtures.FUSION_REPLY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FusionLayerTest {

    private static final String P = LabFixtures.PRIMARY;
    private static final String C = LabFixtures.CHALLENGER;

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final TriageResult triage = TriageResponseParser.parse(LabFixtures.TRIAGE_REPLY);
    private final SpecialtyFinding specialty = SpecialtyResponseParser.parse(LabFixtures.SPECIALTY_REPLY);

    private FusionLayer layer(FakeModelClient client, PipelineProperties props) {
        return new FusionLayer(
                new DefaultDualModelCallService(client, new SyncExecutor(), 5000),
                ReciprocalRankConsensusAggregator.withDefaults(),
                props,
                new PipelineMetricsPublisher(new PipelineMetrics(registry)));
    }

    @Test
    void ranksByConsensusOfBothModels() {
        FakeModelClient client = new FakeModelClient()
                .reply(P, FUSION, FUSION_REPLY)
                .reply(C, CHALLENGER, CHALLENGER_REPLY);

        FusionLayerResult result = layer(client, new PipelineProperties(P, C, true))
                .run(LabFixtures.diabeticRequest(), triage, specialty, "a-1");

        assertThat(result.differentialDiagnosis()).extracting(ConsensusDiagnosis::name)
                .containsExactly("Diabetes Mellitus tipo 2", "Hipotiroidismo", "Metabolic syndrome");
        ConsensusDiagnosis diabetes = result.differentialDiagnosis().get(0);
        assertThat(diabetes.consensusLevel()).isEqualTo(ConsensusLevel.STRONG);
        assertThat(diabetes.aggregateScore()).isCloseTo(2.0, within(1e-9));
        assertThat(diabetes.confidence()).isEqualTo(96);
        assertThat(diabetes.icd10()).isEqualTo("E11");
        assertThat(diabetes.supportingEvidence()).containsExactly("HbA1c 7.1%", "Glucose 142", "Fasting glucose 142");
        assertThat(result.differentialDiagnosis().get(2).consensusLevel()).isEqualTo(ConsensusLevel.SINGLE);

        assertThat(result.investigativeQuestions()).hasSize(1);
        assertThat(result.suggestedTests()).hasSize(1);
        assertThat(result.consensusMetrics().modelsUsed()).containsExactly(P, C);
        assertThat(result.consensusMetrics().modelTimings()).containsOnlyKeys(P, C);
        assertThat(result.consensusMetrics().strongConsensusRate()).isEqualTo(67);
        assertThat(registry.find("labreasoning.pipeline.consensus").tag("level", "strong").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void primaryUsesTextModeAndChallengerJsonMode() {
        FakeModelClient client = new FakeModelClient()
                .reply(P, FUSION, FUSION_REPLY)
                .reply(C, CHALLENGER, CHALLENGER_REPLY);

        layer(client, new PipelineProperties(P, C, true)).run(LabFixtures.diabeticRequest(), triage, specialty, "a-1");

        ModelCallRequest primaryCall = client.callsMatching(FUSION).get(0);
        ModelCallRequest challengerCall = client.callsMatching(CHALLENGER).get(0);
        assertThat(primaryCall.options().jsonMode()).isFalse();
        assertThat(challengerCall.options().jsonMode()).isTrue();
        assertThat(primaryCall.userPrompt())
                .contains("\"urgency\":\"high\"")
                .contains("primaryConcerns")
                .contains("Elevated fasting glucose with HbA1c above 6.5%");
        assertThat(challengerCall.userPrompt())
                .contains("- Urgency: high")
                .contains("- Red flags: HbA1c above 7%");
    }

    @Test
    void challengerFailureFallsBackToSingleModelRanking() {
        FakeModelClient client = new FakeModelClient()
                .reply(P, FUSION, FUSION_REPLY)
                .fail(C, CHALLENGER);

        FusionLayerResult result = layer(client, new PipelineProperties(P, C, true))
                .run(LabFixtures.diabeticRequest(), triage, specialty, "a-2");

        assertThat(result.differentialDiagnosis()).hasSize(2)
                .allSatisfy(d -> assertThat(d.consensusLevel()).isEqualTo(ConsensusLevel.SINGLE));
        assertThat(result.differentialDiagnosis().get(0).confidence()).isEqualTo(68);
        assertThat(result.consensusMetrics().modelsUsed()).containsExactly(P);
        assertThat(result.consensusMetrics().modelTimings()).containsOnlyKeys(P, C);
        assertThat(registry.find("labreasoning.pipeline.model.failure")
                .tag("layer", "fusion").tag("model", C).counter().count()).isEqualTo(1.0);
    }

    @Test
    void disabledChallengerIsNeverCalled() {
        FakeModelClient client = new FakeModelClient().reply(P, FUSION, FUSION_REPLY);

        FusionLayerResult result = layer(client, new PipelineProperties(P, C, false))
                .run(LabFixtures.diabeticRequest(), triage, specialty, "a-3");

        assertThat(client.callsMatching(CHALLENGER)).isEmpty();
        assertThat(result.differentialDiagnosis()).hasSize(2);
        assertThat(result.consensusMetrics().modelTimings()).containsOnlyKeys(P);
    }

    @Test
    void unparseablePrimaryStillUsesChallenger() {
        FakeModelClient client = new FakeModelClient()
                .reply(P, FUSION, "I think it is diabetes.")
                .reply(C, CHALLENGER, CHALLENGER_REPLY);

        FusionLayerResult result = layer(client, new PipelineProperties(P, C, true))
                .run(LabFixtures.diabeticRequest(), triage, specialty, "a-4");

        assertThat(result.differentialDiagnosis()).extracting(ConsensusDiagnosis::name)
                .containsExactly("DM2", "Hipotireoidismo", "Metabolic syndrome");
        assertThat(result.investigativeQuestions()).isEmpty();
        assertThat(result.consensusMetrics().modelsUsed()).containsExactly(C);
        assertThat(registry.find("labreasoning.pipeline.model.failure").tag("reason", "parse_error").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void bothCallsFailingAbortsTheAnalysis() {
        FakeModelClient client = new FakeModelClient().fail(P, FUSION).fail(C, CHALLENGER);

        assertThatThrownBy(() -> layer(client, new PipelineProperties(P, C, true))
                .run(LabFixtures.diabeticRequest(), triage, specialty, "a-5"))
                .isInstanceOf(DiagnosisPipelineException.class)
                .hasMessageContaining("All fusion model calls failed")
                .satisfies(e -> assertThat(((DiagnosisPipelineException) e).getAnalysisId()).isEqualTo("a-5"));
    }

    @Test
    void noParseableReplyFromEitherModelAbortsTheAnalysis() {
        FakeModelClient client = new FakeModelClient()
                .reply(P, FUSION, "sorry, I cannot help")
                .reply(C, CHALLENGER, "no json here");

        assertThatThrownBy(() -> layer(client, new PipelineProperties(P, C, true))
                .run(LabFixtures.diabeticRequest(), triage, specialty, "a-8"))
                .isInstanceOf(DiagnosisPipelineException.class)
                .hasMessageContaining("No fusion reply yielded a diagnosis")
                .satisfies(e -> assertThat(((DiagnosisPipelineException) e).getAnalysisId()).isEqualTo("a-8"));

        assertThat(registry.find("labreasoning.pipeline.model.failure")
                .tag("model", P).tag("reason", "parse_error").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("labreasoning.pipeline.model.failure")
                .tag("model", C).tag("reason", "parse_error").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unparseablePrimaryWithChallengerDisabledAbortsTheAnalysis() {
        FakeModelClient client = new FakeModelClient().reply(P, FUSION, "I think it is diabetes.");

        assertThatThrownBy(() -> layer(client, new PipelineProperties(P, C, false))
                .run(LabFixtures.diabeticRequest(), triage, specialty, "a-9"))
                .isInstanceOf(DiagnosisPipelineException.class)
                .hasMessageContaining("challenger=disabled");
    }

    @Test
    void primaryFailingWithChallengerDisabledAbortsTheAnalysis() {
        FakeModelClient client = new FakeModelClient().fail(P, FUSION);

        assertThatThrownBy(() -> layer(client, new PipelineProperties(P, C, false))
                .run(LabFixtures.diabeticRequest(), triage, specialty, "a-6"))
                .isInstanceOf(DiagnosisPipelineException.class);
    }

    @Test
    void sameModelInBothRolesKeepsSeparateTimings() {
        FakeModelClient client = new FakeModelClient()
                .reply(P, FUSION, FUSION_REPLY)
                .reply(P, CHALLENGER, CHALLENGER_REPLY);

        FusionLayerResult result = layer(client, new PipelineProperties(P, P, true))
                .run(LabFixtures.diabeticRequest(), triage, specialty, "a-7");

        assertThat(result.consensusMetrics().modelTimings()).containsOnlyKeys(P, P + "/challenger");
        assertThat(result.consensusMetrics().modelsUsed()).containsExactly(P, P);
    }
}

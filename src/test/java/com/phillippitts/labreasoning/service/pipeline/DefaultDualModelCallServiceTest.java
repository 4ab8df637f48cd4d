package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.service.model.ModelCallOptions;
import com.phillippitts.labreasoning.service.model.ModelCallOutcome;
import com.phillippitts.labreasoning.service.model.ModelCallRequest;
import com.phillippitts.labreasoning.service.model.ModelClient;
import com.phillippitts.labreasoning.testutil.FakeModelClient;
import com.phillippitts.labreasoning.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.phillippitts.labreasoning.testutil.FakeModelClient.CHALLENGER;
import static com.phillippitts.labreasoning.testutil.FakeModelClient.FUSION;
import static com.phillippitts.labreasoning.testutil.LabFixtures.CHALLENGER_REPLY;
import static com.phillippitts.labreasoning.testutil.LabFixtures.FUSION_REPLY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultDualModelCallServiceTest {

    private static final String P = "primary-model";
    private static final String C = "challenger-model";

    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private static ModelCallRequest primaryCall() {
        return new ModelCallRequest(P, Prompts.FUSION_SYSTEM, "user", ModelCallOptions.text(0.2));
    }

    private static ModelCallRequest challengerCall() {
        return new ModelCallRequest(C, Prompts.CHALLENGER_SYSTEM, "user", ModelCallOptions.json(0.2));
    }

    @Test
    void returnsBothRepliesWhenBothSucceed() {
        FakeModelClient client = new FakeModelClient()
                .reply(P, FUSION, FUSION_REPLY)
                .reply(C, CHALLENGER, CHALLENGER_REPLY);
        DefaultDualModelCallService svc = new DefaultDualModelCallService(client, new SyncExecutor(), 1000);

        DualModelCallService.OutcomePair pair = svc.callBoth(primaryCall(), challengerCall(), 0);

        assertThat(pair.primary().text()).isEqualTo(FUSION_REPLY);
        assertThat(pair.challenger().text()).isEqualTo(CHALLENGER_REPLY);
        assertThat(pair.anySucceeded()).isTrue();
        assertThat(client.calls()).hasSize(2);
    }

    @Test
    void oneFailureDoesNotAffectTheOther() {
        FakeModelClient client = new FakeModelClient()
                .reply(P, FUSION, FUSION_REPLY)
                .fail(C, CHALLENGER);
        DefaultDualModelCallService svc = new DefaultDualModelCallService(client, new SyncExecutor(), 1000);

        DualModelCallService.OutcomePair pair = svc.callBoth(primaryCall(), challengerCall(), 0);

        assertThat(pair.primary().succeeded()).isTrue();
        assertThat(pair.challenger().status()).isEqualTo(ModelCallOutcome.Status.FAILED);
        assertThat(pair.challenger().failureReason()).contains("scripted failure");
        assertThat(pair.challenger().modelId()).isEqualTo(C);
    }

    @Test
    void unexpectedErrorsAreCaptured() {
        FakeModelClient client = new FakeModelClient()
                .throwing(P, FUSION, new IllegalStateException("bug"))
                .fail(C, CHALLENGER);
        DefaultDualModelCallService svc = new DefaultDualModelCallService(client, new SyncExecutor(), 1000);

        DualModelCallService.OutcomePair pair = svc.callBoth(primaryCall(), challengerCall(), 0);

        assertThat(pair.primary().failureReason()).isEqualTo("unexpected_error");
        assertThat(pair.anySucceeded()).isFalse();
    }

    @Test
    void errorEscapingOneCallKeepsTheOtherOutcome() {
        ModelClient client = new ModelClient() {
            @Override
            public String invoke(String modelId, String systemPrompt, String userPrompt, ModelCallOptions options) {
                if (P.equals(modelId)) {
                    throw new AssertionError("native crash");
                }
                return CHALLENGER_REPLY;
            }

            @Override
            public Set<String> availableModels() {
                return Set.of(P, C);
            }
        };
        DefaultDualModelCallService svc = new DefaultDualModelCallService(client, new SyncExecutor(), 1000);

        DualModelCallService.OutcomePair pair = svc.callBoth(primaryCall(), challengerCall(), 0);

        assertThat(pair.primary().status()).isEqualTo(ModelCallOutcome.Status.FAILED);
        assertThat(pair.primary().failureReason()).isEqualTo("unexpected_error");
        assertThat(pair.challenger().text()).isEqualTo(CHALLENGER_REPLY);
    }

    @Test
    void nullChallengerIsSkipped() {
        FakeModelClient client = new FakeModelClient().reply(P, FUSION, FUSION_REPLY);
        DefaultDualModelCallService svc = new DefaultDualModelCallService(client, new SyncExecutor(), 1000);

        DualModelCallService.OutcomePair pair = svc.callBoth(primaryCall(), null, 0);

        assertThat(pair.challenger().status()).isEqualTo(ModelCallOutcome.Status.SKIPPED);
        assertThat(client.calls()).hasSize(1);
    }

    @Test
    void slowCallResolvesToTimeoutWhileFastCallSucceeds() {
        pool = Executors.newFixedThreadPool(2);
        FakeModelClient client = new FakeModelClient()
                .reply(P, FUSION, FUSION_REPLY)
                .replyAfter(C, CHALLENGER, CHALLENGER_REPLY, 3000);
        DefaultDualModelCallService svc = new DefaultDualModelCallService(client, pool, 1000);

        long t0 = System.nanoTime();
        DualModelCallService.OutcomePair pair = svc.callBoth(primaryCall(), challengerCall(), 200);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;

        assertThat(pair.primary().succeeded()).isTrue();
        assertThat(pair.challenger().status()).isEqualTo(ModelCallOutcome.Status.FAILED);
        assertThat(pair.challenger().failureReason()).isEqualTo("timeout");
        assertThat(pair.challenger().durationMs()).isEqualTo(200);
        assertThat(elapsedMs).isLessThan(2500);
    }

    @Test
    void rejectsNullPrimary() {
        DefaultDualModelCallService svc = new DefaultDualModelCallService(new FakeModelClient(), new SyncExecutor(), 1000);

        assertThatThrownBy(() -> svc.callBoth(null, challengerCall(), 0)).isInstanceOf(NullPointerException.class);
    }
}

/**
 * Four-layer clinical reasoning pipeline.
 *
 * <p>{@link com.phillippitts.labreasoning.service.pipeline.ClinicalReasoningPipeline} runs
 * {@link com.phillippitts.labreasoning.service.pipeline.TriageLayer},
 * {@link com.phillippitts.labreasoning.service.pipeline.SpecialtyLayer},
 * {@link com.phillippitts.labreasoning.service.pipeline.FusionLayer} and
 * {@link com.phillippitts.labreasoning.service.pipeline.ExplainabilityLayer} in that order.
 * The fusion layer issues its two model calls through
 * {@link com.phillippitts.labreasoning.service.pipeline.DualModelCallService} and ranks the replies
 * with a {@link com.phillippitts.labreasoning.service.consensus.ConsensusAggregator}.
 */
package com.phillippitts.labreasoning.service.pipeline;

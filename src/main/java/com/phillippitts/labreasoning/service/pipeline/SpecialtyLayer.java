package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.config.properties.PipelineProperties;
import com.phillippitts.labreasoning.domain.ClinicalSpecialty;
import com.phillippitts.labreasoning.domain.LabAnalysisRequest;
import com.phillippitts.labreasoning.domain.SpecialtyFinding;
import com.phillippitts.labreasoning.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.labreasoning.service.model.ModelCallOptions;
import com.phillippitts.labreasoning.service.model.ModelClient;
import com.phillippitts.labreasoning.service.parse.SpecialtyResponseParser;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Layer 2: focused investigation by the detected specialty. Failure yields an empty finding.
 */
@Component
public class SpecialtyLayer extends AbstractPipelineLayer {

    public SpecialtyLayer(ModelClient modelClient, PipelineProperties properties, PipelineMetricsPublisher metrics) {
        super(modelClient, properties, metrics);
    }

    @Override
    protected PipelineStage stage() {
        return PipelineStage.SPECIALTY;
    }

    public SpecialtyFinding run(LabAnalysisRequest request) {
        ClinicalSpecialty specialty = request.detectedSpecialty();
        String prompt = PromptFormatter.fill(Prompts.SPECIALTY, Map.of(
                "specialty", specialty.displayName(),
                "focus", specialty.focus(),
                "patientContext", PromptFormatter.formatPatientContext(request.patientContext()),
                "labResults", PromptFormatter.formatMarkers(request.biomarkers())));
        return callAndParse(
                "You are a " + specialty.displayName() + " specialist. Reply with JSON only.",
                prompt,
                ModelCallOptions.text(properties.getSpecialtyTemperature()),
                SpecialtyResponseParser::parse,
                SpecialtyFinding::empty);
    }
}

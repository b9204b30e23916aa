package com.uchion.infrastructure.ai;

import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.Subject;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Picks the oracle model per call site. Early grades go to the cheap agents model,
 * other STEM batches to the reasoning-capable verifier.
 */
@Component
public class ModelRouter {

    private static final int EARLY_GRADE_MAX = 6;

    private final String agentsModel;
    private final String verifierStemModel;
    private final String verifierHumanitiesModel;

    public ModelRouter(@Value("${oracle.models.agents:openai/gpt-4.1-mini}") String agentsModel,
                       @Value("${oracle.models.verifier-stem:google/gemini-3-flash-preview}") String verifierStemModel,
                       @Value("${oracle.models.verifier-humanities:google/gemini-2.5-flash-lite}") String verifierHumanitiesModel) {
        this.agentsModel = agentsModel;
        this.verifierStemModel = verifierStemModel;
        this.verifierHumanitiesModel = verifierHumanitiesModel;
    }

    public String answerJudgeModel(DomainContext context) {
        return tieredModel(context);
    }

    public String fixerModel(DomainContext context) {
        return tieredModel(context);
    }

    public String qualityJudgeModel() {
        return agentsModel;
    }

    private String tieredModel(DomainContext context) {
        Subject subject = context.subject();
        boolean earlyGrade = context.grade() > 0 && context.grade() <= EARLY_GRADE_MAX;
        if (subject.isStem()) {
            if (earlyGrade && subject == Subject.MATH) {
                return agentsModel;
            }
            return verifierStemModel;
        }
        if (earlyGrade) {
            return agentsModel;
        }
        return verifierHumanitiesModel;
    }
}

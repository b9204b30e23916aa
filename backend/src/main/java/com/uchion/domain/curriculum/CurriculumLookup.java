package com.uchion.domain.curriculum;

import com.uchion.domain.worksheet.model.Subject;

import java.util.List;
import java.util.Optional;

/**
 * Curriculum topic list per subject and grade, used to phrase judge prompts.
 */
public interface CurriculumLookup {

    /**
     * @return the grade's topics, or empty when the subject/grade pair is not configured
     */
    Optional<List<String>> topicsFor(Subject subject, int grade);
}

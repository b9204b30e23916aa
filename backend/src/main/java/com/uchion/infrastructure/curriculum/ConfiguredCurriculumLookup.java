package com.uchion.infrastructure.curriculum;

import com.uchion.domain.curriculum.CurriculumLookup;
import com.uchion.domain.worksheet.model.Subject;
import com.uchion.infrastructure.config.CurriculumProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class ConfiguredCurriculumLookup implements CurriculumLookup {

    private final CurriculumProperties properties;

    @Override
    public Optional<List<String>> topicsFor(Subject subject, int grade) {
        Map<Integer, List<String>> byGrade = properties.getTopics().get(subject.wireName());
        if (byGrade == null) {
            return Optional.empty();
        }
        List<String> topics = byGrade.get(grade);
        if (topics == null || topics.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(List.copyOf(topics));
    }
}

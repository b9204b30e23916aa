package com.uchion.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Curriculum topic table: subject wire name -> grade -> topics.
 */
@Data
@Component
@ConfigurationProperties(prefix = "curriculum")
public class CurriculumProperties {

    private Map<String, Map<Integer, List<String>>> topics = new HashMap<>();
}

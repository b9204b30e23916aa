package com.uchion.domain.worksheet.model;

/**
 * Domain facts a judge or the fixer needs to phrase its request.
 *
 * @param subject    content domain
 * @param grade      school grade, 1..11
 * @param topic      worksheet topic as entered by the teacher
 * @param difficulty requested difficulty (nullable, judges then skip the difficulty check wording)
 */
public record DomainContext(
        Subject subject,
        int grade,
        String topic,
        Difficulty difficulty
) {}

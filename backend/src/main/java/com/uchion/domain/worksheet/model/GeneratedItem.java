package com.uchion.domain.worksheet.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One generated worksheet exercise. Each variant carries only the fields of its kind.
 * <p>
 * Items have no identity of their own: inside a batch they are addressed by position.
 * The JSON form uses a {@code type} discriminator with the wire names of {@link ItemKind}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SingleChoiceItem.class, name = "single_choice"),
        @JsonSubTypes.Type(value = MultipleChoiceItem.class, name = "multiple_choice"),
        @JsonSubTypes.Type(value = OpenQuestionItem.class, name = "open_question"),
        @JsonSubTypes.Type(value = MatchingItem.class, name = "matching"),
        @JsonSubTypes.Type(value = FillBlankItem.class, name = "fill_blank")
})
public interface GeneratedItem {

    @JsonIgnore
    ItemKind kind();

    /**
     * Main text shown to the pupil: the question, the matching instruction or the gapped text.
     */
    @JsonIgnore
    String promptText();
}

package com.uchion.interfaces.api.dto;

import com.uchion.domain.worksheet.model.Difficulty;
import com.uchion.domain.worksheet.model.GeneratedItem;
import com.uchion.domain.worksheet.model.Subject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ValidateRequest(
        @NotEmpty(message = "Нужно передать хотя бы одно задание")
        List<@NotNull(message = "Задание не может быть пустым") GeneratedItem> items,

        @NotNull(message = "Предмет обязателен")
        Subject subject,

        @Min(value = 1, message = "Класс должен быть от 1 до 11")
        @Max(value = 11, message = "Класс должен быть от 1 до 11")
        int grade,

        @NotBlank(message = "Тема обязательна")
        @Size(max = 200, message = "Тема не должна превышать 200 символов")
        String topic,

        Difficulty difficulty,

        Boolean autoFix
) {
    public boolean autoFixOrDefault() {
        return autoFix == null || autoFix;
    }
}

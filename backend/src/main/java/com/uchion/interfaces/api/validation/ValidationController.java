package com.uchion.interfaces.api.validation;

import com.uchion.application.validation.ValidationAppService;
import com.uchion.domain.validation.model.ValidationReport;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.interfaces.api.dto.ValidateRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/validation")
@RequiredArgsConstructor
public class ValidationController {

    private final ValidationAppService validationAppService;

    @PostMapping
    public ResponseEntity<ValidationReport> validate(@Valid @RequestBody ValidateRequest request) {
        DomainContext context = new DomainContext(
                request.subject(),
                request.grade(),
                request.topic(),
                request.difficulty());

        ValidationReport report = validationAppService.validate(request.items(), context, request.autoFixOrDefault());
        return ResponseEntity.ok(report);
    }
}

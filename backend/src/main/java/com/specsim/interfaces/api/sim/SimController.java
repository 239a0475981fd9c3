package com.specsim.interfaces.api.sim;

import com.specsim.application.sim.SimAppService;
import com.specsim.domain.sim.model.PipelineResult;
import com.specsim.domain.sim.model.ValidationReport;
import com.specsim.infrastructure.sim.serialization.SimFormat;
import com.specsim.interfaces.api.dto.BuildSimRequest;
import com.specsim.interfaces.api.dto.BuildSimResponse;
import com.specsim.interfaces.api.dto.ValidateSimRequest;
import com.specsim.interfaces.api.dto.ValidationReportResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/sim")
@RequiredArgsConstructor
public class SimController {

    private final SimAppService simAppService;

    @PostMapping("/build")
    public ResponseEntity<BuildSimResponse> build(@Valid @RequestBody BuildSimRequest request) {
        PipelineResult result = simAppService.build(request);
        return ResponseEntity.ok(BuildSimResponse.from(result, simAppService.toDocument(result.model())));
    }

    @PostMapping("/export")
    public ResponseEntity<String> export(@Valid @RequestBody BuildSimRequest request,
                                         @RequestParam(value = "format", required = false) String format) {
        SimFormat simFormat = SimFormat.fromParam(format);
        String body = simAppService.export(request, simFormat);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(simFormat.mediaType()))
                .body(body);
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationReportResponse> validate(@Valid @RequestBody ValidateSimRequest request) {
        ValidationReport report = simAppService.validate(request.model(), request.priorModel());
        return ResponseEntity.ok(ValidationReportResponse.from(report));
    }

    /**
     * Validate a serialized SIM posted as-is (JSON or YAML text).
     */
    @PostMapping(value = "/validate/raw", consumes = {MediaType.TEXT_PLAIN_VALUE, "application/yaml", MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<ValidationReportResponse> validateRaw(@RequestBody String content,
                                                                @RequestParam(value = "format", required = false) String format) {
        ValidationReport report = simAppService.validate(content, SimFormat.fromParam(format));
        return ResponseEntity.ok(ValidationReportResponse.from(report));
    }
}

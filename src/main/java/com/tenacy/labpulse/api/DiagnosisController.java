package com.tenacy.labpulse.api;

import com.tenacy.labpulse.api.dto.DiagnosisRequest;
import com.tenacy.labpulse.domain.DiagnosisResult;
import com.tenacy.labpulse.service.DiagnosisService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/diagnosis")
@RequiredArgsConstructor
public class DiagnosisController {

    private final DiagnosisService diagnosisService;

    @PostMapping("/analyze")
    public ResponseEntity<DiagnosisResult> analyze(@RequestBody DiagnosisRequest request) {
        return ResponseEntity.ok(diagnosisService.diagnose(request));
    }
}

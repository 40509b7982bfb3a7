package com.tenacy.labpulse.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagnosisRequest {
    private String instrumentId;
    private List<String> symptoms;
    private List<String> errorCodes;
}

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
public class DetectionRequest {
    private String instrumentId;
    /** 비어 있으면 모든 감지 방식 실행 */
    private List<String> methods;
}

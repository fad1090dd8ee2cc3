package com.syntegra.assessment.modules.answer.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class AutoSaveResponse {
    private UUID answerId;
    private Boolean isNew;
    private Instant autoSavedAt;
}

package com.syntegra.assessment.modules.attempt.dto;

import com.syntegra.assessment.modules.attempt.AttemptStatus;
import com.syntegra.assessment.modules.session.SessionResult;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class AttemptListResponse {
    private List<AttemptDto> attempts;
    private int page;
    private int size;
    private long totalElements;
    private int totalPages;
    /** Attempt counts per status; only filled for per-user listings. */
    private Map<AttemptStatus, Long> statusCounts;
    /** Reporting aggregates; only filled for per-session listings. */
    private List<SessionResult> sessionResults;
}

package com.syntegra.assessment.modules.answer.dto;

import com.syntegra.assessment.modules.catalog.QuestionType;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
public class AnswerDto {
    private UUID id;
    private UUID attemptId;
    private UUID questionId;
    private Integer questionSequence;
    private QuestionType questionType;
    private String answer;
    private Map<String, Object> answerData;
    private BigDecimal score;
    private Boolean isCorrect;
    private Integer timeTaken;
    private Integer confidenceLevel;
    private Instant answeredAt;
    private Boolean isAnswered;
    /** Only filled in for admins. */
    private String correctAnswer;
}

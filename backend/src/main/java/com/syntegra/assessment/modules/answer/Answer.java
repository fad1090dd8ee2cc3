package com.syntegra.assessment.modules.answer;

import com.syntegra.assessment.modules.catalog.Question;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "user_answers")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Answer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "question_id", nullable = false, updatable = false)
    private UUID questionId;

    @Column(name = "attempt_id", nullable = false, updatable = false)
    private UUID attemptId;

    /** Read-only view of {@link #questionId}, used to order listings by question sequence. */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "question_id", insertable = false, updatable = false)
    private Question question;

    @Column(columnDefinition = "TEXT")
    private String answer;

    /** Structured response for drawing, sequence, matrix and rating items. */
    @Column(name = "answer_data", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> answerData;

    /** Null while the answer is a draft. */
    @Column(precision = 6, scale = 2)
    private BigDecimal score;

    /** Seconds. */
    @Column(name = "time_taken")
    private Integer timeTaken;

    @Column(name = "is_correct")
    private Boolean isCorrect;

    @Column(name = "confidence_level")
    private Integer confidenceLevel;

    @Column(name = "answered_at")
    private Instant answeredAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean hasContent() {
        return answer != null || (answerData != null && !answerData.isEmpty());
    }
}

package com.syntegra.assessment.modules.session;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "session_modules")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionModule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "test_id", nullable = false)
    private UUID testId;

    @Column(nullable = false)
    private Integer sequence;

    @Column(name = "is_required", nullable = false)
    @Builder.Default
    private Boolean isRequired = true;

    @Column(precision = 5, scale = 2, nullable = false)
    @Builder.Default
    private BigDecimal weight = BigDecimal.ONE;
}

package com.forecastbench.entity;

import com.forecastbench.config.RequestIdFilter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
    name = "evaluation_records",
    indexes = {
        @Index(name = "idx_eval_created", columnList = "created_at"),
        @Index(name = "idx_eval_label",   columnList = "label"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(length = 100)
    private String label;

    @Column(name = "series_count", nullable = false)
    private int seriesCount;

    @Convert(converter = ScoreMapConverter.class)
    @Column(name = "smape_scores", nullable = false, length = 1024)
    private Map<String, Double> smape;

    @Convert(converter = ScoreMapConverter.class)
    @Column(name = "owa_scores", nullable = false, length = 1024)
    private Map<String, Double> owa;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "request_id", length = RequestIdFilter.MAX_LENGTH)
    private String requestId;
}

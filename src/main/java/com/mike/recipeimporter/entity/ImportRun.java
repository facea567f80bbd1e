package com.mike.recipeimporter.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "runs",
        indexes = {
                @Index(name = "idx_runs_started_at", columnList = "started_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "mode", nullable = false, length = 20)
    private String mode;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "urls_discovered", nullable = false)
    private int urlsDiscovered;

    @Column(name = "urls_imported", nullable = false)
    private int urlsImported;

    @Column(name = "urls_failed", nullable = false)
    private int urlsFailed;

    @Column(name = "urls_skipped", nullable = false)
    private int urlsSkipped;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;
}

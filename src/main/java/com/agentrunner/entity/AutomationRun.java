package com.agentrunner.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "automation_run")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AutomationRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "automation_id", nullable = false, length = 64)
    private String automationId;

    @Column(name = "triggered_by")
    private UUID triggeredBy;

    @Column(name = "entry_point", length = 120)
    private String entryPoint;

    @Column(name = "mode", length = 20)
    private String mode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "seed_input", columnDefinition = "TEXT")
    private String seedInput;

    @Column(name = "result_data", columnDefinition = "TEXT")
    private String resultData;

    @CreationTimestamp
    @Column(name = "started_at", nullable = false, updatable = false)
    private OffsetDateTime startedAt;

    @Column(name = "finished_at")
    private OffsetDateTime finishedAt;
}

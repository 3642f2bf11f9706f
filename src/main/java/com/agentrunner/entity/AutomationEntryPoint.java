package com.agentrunner.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * One way of starting an automation. {@code type} is kept as free text so that kinds this
 * service cannot seed can still be catalogued; they are skipped at dispatch time.
 */
@Entity
@Table(name = "automation_entry_point")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AutomationEntryPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "automation_id", nullable = false)
    private Automation automation;

    @Column(nullable = false, length = 120)
    private String name;

    @Column(nullable = false, length = 120)
    private String type;

    @Column(nullable = false)
    private boolean disabled;

    @Column(nullable = false)
    private int position;
}

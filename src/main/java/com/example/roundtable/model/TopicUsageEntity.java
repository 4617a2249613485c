package com.example.roundtable.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;

@Entity
@Table(
    name = "topics",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_topics_title_category", columnNames = {"title", "category"})
    }
)
public class TopicUsageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 200)
    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 500)
    private String description;

    @Column(length = 100)
    private String category;

    @Column(nullable = false, length = 40)
    private String source = "fallback";

    @Column(nullable = false)
    private long usedCount = 0;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    protected TopicUsageEntity() {}

    public TopicUsageEntity(String title, String description, String category, String source) {
        this.title = title;
        this.description = description;
        this.category = category;
        if (source != null && !source.isBlank()) this.source = source;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) this.createdAt = Instant.now();
    }

    public void markUsed() {
        this.usedCount++;
    }

    public Long getId() { return id; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getCategory() { return category; }
    public String getSource() { return source; }
    public long getUsedCount() { return usedCount; }
    public Instant getCreatedAt() { return createdAt; }
}

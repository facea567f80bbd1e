package com.mike.recipeimporter.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "urls",
        indexes = {
                @Index(name = "idx_urls_domain", columnList = "domain"),
                @Index(name = "idx_urls_status", columnList = "status"),
                @Index(name = "idx_urls_source_key", columnList = "source_key"),
                @Index(name = "idx_urls_discovered_at", columnList = "discovered_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UrlRecord {

    // normalized url
    @Id
    @Column(name = "url", nullable = false, length = 2048)
    private String url;

    @Column(name = "domain", nullable = false, length = 255)
    private String domain;

    @Column(name = "source_key", nullable = false, length = 100)
    private String sourceKey;

    @Column(name = "discovered_at", nullable = false)
    private LocalDateTime discoveredAt;

    @Column(name = "imported_at")
    private LocalDateTime importedAt;

    @Column(name = "status", nullable = false, length = 32)
    private UrlStatus status;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    // recipe slug on the destination side
    @Column(name = "destination_id", length = 255)
    private String destinationId;

    @Column(name = "content_hash", length = 64)
    private String contentHash;

    @Column(name = "reimport", nullable = false)
    private boolean reimport;
}

package com.premiergroup.campaign_health.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Raw daily insight row as synced from the ads platform. Ratios are derived when
 * the row is turned into a {@link com.premiergroup.campaign_health.dto.DailyMetric}.
 */
@Entity
@Table(name = "campaign_metrics")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class CampaignMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id", nullable = false)
    private Campaign campaign;

    @Column(name = "stats_date", nullable = false)
    private LocalDate statsDate;

    private Long impressions;
    private Long clicks;
    private BigDecimal cost;
    private Integer purchases;
    private BigDecimal revenue;
    private BigDecimal frequency;
}

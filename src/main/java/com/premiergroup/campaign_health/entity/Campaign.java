package com.premiergroup.campaign_health.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Set;

@Entity
@Table(name = "campaigns")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "metrics")
@ToString(exclude = "metrics")
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "marketing_channels_id", nullable = false)
    private MarketingChannel marketingChannel;

    // id on the ads platform
    @Column(name = "campaign_id", nullable = false)
    private String campaignId;

    private String name;
    private String status;

    @Column(name = "created_time")
    private LocalDateTime createdTime;

    @Column(name = "daily_budget")
    private BigDecimal dailyBudget;

    @OneToMany(mappedBy = "campaign")
    private Set<CampaignMetric> metrics;
}

package com.premiergroup.campaign_health.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.Set;

/**
 * Ads platform a campaign runs on (Facebook, Google Ads, ...).
 */
@Entity
@Table(name = "marketing_channels")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "campaigns")
@ToString(exclude = "campaigns")
public class MarketingChannel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "source_name")
    private String sourceName;

    @Column(name = "is_active")
    private Boolean isActive;

    @Column(name = "settlement_currency")
    private String settlementCurrency;

    @OneToMany(mappedBy = "marketingChannel")
    private Set<Campaign> campaigns;
}

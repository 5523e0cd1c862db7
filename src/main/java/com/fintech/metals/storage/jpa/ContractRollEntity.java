package com.fintech.metals.storage.jpa;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Current month1/month2/month3 labels of one instrument.
 */
@Entity
@Table(name = "contract_rolls")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractRollEntity {

    @Id
    @Column(length = 64)
    private String instrument;

    @Column(name = "month1_label", length = 32)
    private String month1Label;

    @Column(name = "month2_label", length = 32)
    private String month2Label;

    @Column(name = "month3_label", length = 32)
    private String month3Label;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}

package com.community.kolokwa.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PointTransactionDTO {

    private Integer points;

    private String transactionType;

    private String description;

    private LocalDateTime createdAt;
}

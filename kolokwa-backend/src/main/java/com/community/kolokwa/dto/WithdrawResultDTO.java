package com.community.kolokwa.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawResultDTO {

    private Long entryId;

    // true when the row was removed, false when it was only marked rejected
    private boolean deleted;

    private String status;
}

package com.sneaklink.dispute.dto;

import lombok.Data;

@Data
public class RejectDisputeRequest {

    private String note;
}

package com.flagship.fx_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of submit, approve and reject.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalActionRequest {

    @Size(max = 1000, message = "Comment must be at most 1000 characters")
    @JsonProperty("comment")
    private String comment;
}

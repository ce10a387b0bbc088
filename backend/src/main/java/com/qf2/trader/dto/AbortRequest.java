package com.qf2.trader.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AbortRequest {

    @Size(max = 200)
    private String reason;
}

package com.example.berry.api.request;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SelectRequest {

    @NotNull
    @Min(0)
    private Integer index;
}
